package tech.relationsync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted bookkeeping for one domain object: the tuple set last applied to the
 * relationship store and where the object is in its sync lifecycle.
 *
 * <p>Records are immutable; transitions return a new record and reject moves the
 * state machine does not allow.
 */
public record SyncRecord(
    DomainObjectRef ref,

    /**
     * Tuples believed present in the store for this object. After a failed apply this
     * is the union of the previous set and the attempted additions.
     */
    RelationshipSet lastAppliedSet,

    /**
     * When the object was last confirmed in sync, null if never.
     */
    Instant lastSyncedAt,

    SyncStatus status,

    /**
     * Error from the last failed apply, null otherwise.
     */
    String lastError,

    Instant updatedAt
) {

    public SyncRecord {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(status, "status");
        lastAppliedSet = lastAppliedSet == null ? RelationshipSet.empty() : lastAppliedSet;
    }

    public static SyncRecord unsynced(DomainObjectRef ref, Instant now) {
        return new SyncRecord(ref, RelationshipSet.empty(), null, SyncStatus.UNSYNCED, null, now);
    }

    public SyncRecord syncing(Instant now) {
        return syncing(lastAppliedSet, now);
    }

    /**
     * Start an apply, widening the stored set to every tuple that may exist while it runs.
     */
    public SyncRecord syncing(RelationshipSet possiblyPresent, Instant now) {
        return transition(SyncStatus.SYNCING, possiblyPresent, lastSyncedAt, lastError, now);
    }

    public SyncRecord synced(RelationshipSet applied, Instant now) {
        return transition(SyncStatus.SYNCED, applied, now, null, now);
    }

    public SyncRecord failed(RelationshipSet possiblyPresent, String error, Instant now) {
        return transition(SyncStatus.FAILED, possiblyPresent, lastSyncedAt, error, now);
    }

    private SyncRecord transition(SyncStatus next, RelationshipSet applied, Instant syncedAt, String error, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal sync transition " + status + " -> " + next + " for " + ref);
        }
        return new SyncRecord(ref, applied, syncedAt, next, error, now);
    }

    public boolean isSynced() {
        return status == SyncStatus.SYNCED;
    }
}
