package tech.relationsync.store;

import tech.relationsync.model.Relationship;

import java.util.List;

/**
 * Tuple read/write/delete interface onto the remote relationship store.
 *
 * <p>Implementations throw {@link RelationStoreException.Unavailable} for failures worth
 * retrying and {@link RelationStoreException.Rejected} or {@link RelationStoreException.Conflict}
 * for failures that will not go away on their own.
 */
public interface RelationshipStore {

    /**
     * Write tuples. With {@code touch=true} tuples that already exist are not an error.
     * With {@code touch=false} the whole request fails with a conflict if any tuple exists,
     * and nothing from it is written.
     */
    void writeRelationships(boolean touch, List<Relationship> relationships);

    /**
     * Delete tuples. Tuples that do not exist are ignored.
     */
    void deleteRelationships(List<Relationship> relationships);

    /**
     * Read every tuple matching the filter.
     */
    List<Relationship> readRelationships(RelationshipFilter filter);
}
