package tech.relationsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Immutable, duplicate-free set of tuples with a deterministic iteration order.
 *
 * <p>Membership uses a hash index, so {@link #minus} and {@link #union} are linear
 * in the size of the operands. Serializes as a plain JSON array.
 */
public final class RelationshipSet implements Iterable<Relationship> {

    private static final RelationshipSet EMPTY = new RelationshipSet(List.of(), Set.of());

    private final List<Relationship> ordered;
    private final Set<Relationship> index;

    private RelationshipSet(List<Relationship> ordered, Set<Relationship> index) {
        this.ordered = ordered;
        this.index = index;
    }

    public static RelationshipSet empty() {
        return EMPTY;
    }

    public static RelationshipSet of(Relationship... relationships) {
        return copyOf(List.of(relationships));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RelationshipSet copyOf(Collection<Relationship> relationships) {
        if (relationships == null || relationships.isEmpty()) {
            return EMPTY;
        }
        TreeSet<Relationship> sorted = new TreeSet<>(relationships);
        return new RelationshipSet(List.copyOf(sorted), Collections.unmodifiableSet(new HashSet<>(sorted)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(Relationship relationship) {
        return index.contains(relationship);
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    /**
     * Tuples in this set that are not in {@code other}.
     */
    public RelationshipSet minus(RelationshipSet other) {
        if (other.isEmpty() || isEmpty()) {
            return this;
        }
        List<Relationship> remaining = new ArrayList<>();
        for (Relationship relationship : ordered) {
            if (!other.contains(relationship)) {
                remaining.add(relationship);
            }
        }
        if (remaining.size() == ordered.size()) {
            return this;
        }
        return remaining.isEmpty() ? EMPTY : fromSorted(remaining);
    }

    public RelationshipSet union(RelationshipSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return copyOf(Stream.concat(ordered.stream(), other.ordered.stream()).toList());
    }

    @JsonValue
    public List<Relationship> asList() {
        return ordered;
    }

    public Stream<Relationship> stream() {
        return ordered.stream();
    }

    @Override
    public Iterator<Relationship> iterator() {
        return ordered.iterator();
    }

    private static RelationshipSet fromSorted(List<Relationship> sorted) {
        return new RelationshipSet(List.copyOf(sorted), Collections.unmodifiableSet(new HashSet<>(sorted)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelationshipSet that)) return false;
        return index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return index.hashCode();
    }

    @Override
    public String toString() {
        return ordered.toString();
    }

    /**
     * Accumulates tuples; duplicates are collapsed on {@link #build()}.
     */
    public static final class Builder {

        private final List<Relationship> relationships = new ArrayList<>();

        private Builder() {
        }

        public Builder add(Relationship relationship) {
            relationships.add(relationship);
            return this;
        }

        public Builder addAll(Iterable<Relationship> more) {
            more.forEach(relationships::add);
            return this;
        }

        public RelationshipSet build() {
            return copyOf(relationships);
        }
    }
}
