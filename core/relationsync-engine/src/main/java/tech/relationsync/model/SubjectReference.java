package tech.relationsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.Objects;

/**
 * The subject side of a tuple. A null relation means the object itself;
 * otherwise it denotes a subject set such as {@code group:G#member}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubjectReference(ObjectReference object, String relation) implements Comparable<SubjectReference> {

    private static final Comparator<SubjectReference> ORDER = Comparator
        .comparing(SubjectReference::object)
        .thenComparing(SubjectReference::relation, Comparator.nullsFirst(Comparator.naturalOrder()));

    public SubjectReference {
        Objects.requireNonNull(object, "object");
        if (relation != null && relation.isBlank()) {
            relation = null;
        }
    }

    public static SubjectReference of(ObjectReference object) {
        return new SubjectReference(object, null);
    }

    public static SubjectReference of(ObjectReference object, String relation) {
        return new SubjectReference(object, relation);
    }

    @Override
    public int compareTo(SubjectReference other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return relation == null ? object.toString() : object + "#" + relation;
    }
}
