package tech.relationsync.sync;

/**
 * How the previous state of an object is established before diffing, and how much of the
 * resulting delta is applied.
 */
public enum SyncMode {
    /** Trust the sync record's last applied set. */
    CHANGE,
    /**
     * Like {@link #CHANGE}, but only write additions. Used ahead of dependent syncs so nothing
     * they are about to reference is revoked first; a full {@link #CHANGE} always follows.
     */
    GRANTS_ONLY,
    /** Read what the store actually holds and repair any drift. */
    RECONCILE;

    /**
     * The mode a coalesced request runs with. Reconcile wins; otherwise a pending grants-only
     * phase holds back revocations until its own full sync arrives.
     */
    public SyncMode merge(SyncMode other) {
        if (this == RECONCILE || other == RECONCILE) {
            return RECONCILE;
        }
        return this == GRANTS_ONLY || other == GRANTS_ONLY ? GRANTS_ONLY : CHANGE;
    }
}
