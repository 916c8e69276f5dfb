package tech.relationsync.diff;

import tech.relationsync.model.RelationshipDelta;
import tech.relationsync.model.RelationshipSet;

/**
 * Minimal delta between two canonical sets.
 *
 * <p>Applying the additions and the removals to a store holding exactly {@code previous}
 * leaves it holding exactly {@code current}, in either order, since the two sides are disjoint.
 */
public final class RelationshipDiffer {

    private RelationshipDiffer() {
    }

    public static RelationshipDelta diff(RelationshipSet previous, RelationshipSet current) {
        return new RelationshipDelta(current.minus(previous), previous.minus(current));
    }
}
