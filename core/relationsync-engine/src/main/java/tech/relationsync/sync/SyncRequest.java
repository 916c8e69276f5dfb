package tech.relationsync.sync;

import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.rbac.ReplicationEventType;

import java.util.Objects;

/**
 * A request to bring one domain object's tuples in line with its current RBAC state.
 */
public record SyncRequest(DomainObjectRef ref, SyncMode mode, ReplicationEventType eventType) {

    public SyncRequest {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(mode, "mode");
    }

    public static SyncRequest change(DomainObjectRef ref, ReplicationEventType eventType) {
        return new SyncRequest(ref, SyncMode.CHANGE, eventType);
    }

    public static SyncRequest grantsOnly(DomainObjectRef ref, ReplicationEventType eventType) {
        return new SyncRequest(ref, SyncMode.GRANTS_ONLY, eventType);
    }

    public static SyncRequest reconcile(DomainObjectRef ref) {
        return new SyncRequest(ref, SyncMode.RECONCILE, ReplicationEventType.RECONCILE);
    }

    /**
     * Fold a newer request for the same object into this one.
     */
    public SyncRequest supersededBy(SyncRequest newer) {
        if (!ref.equals(newer.ref)) {
            throw new IllegalArgumentException("Cannot merge requests for " + ref + " and " + newer.ref);
        }
        return new SyncRequest(ref, mode.merge(newer.mode),
            newer.eventType != null ? newer.eventType : eventType);
    }
}
