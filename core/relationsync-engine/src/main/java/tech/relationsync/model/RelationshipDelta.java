package tech.relationsync.model;

import java.util.Objects;

/**
 * The tuples to add and to remove to move the store from one canonical set to another.
 * The two sides are always disjoint.
 */
public record RelationshipDelta(RelationshipSet additions, RelationshipSet removals) {

    public RelationshipDelta {
        Objects.requireNonNull(additions, "additions");
        Objects.requireNonNull(removals, "removals");
    }

    public static RelationshipDelta none() {
        return new RelationshipDelta(RelationshipSet.empty(), RelationshipSet.empty());
    }

    public boolean isEmpty() {
        return additions.isEmpty() && removals.isEmpty();
    }

    public int size() {
        return additions.size() + removals.size();
    }

    @Override
    public String toString() {
        return "+" + additions.size() + "/-" + removals.size();
    }
}
