package tech.relationsync.sync;

import tech.relationsync.model.DomainObjectRef;

/**
 * Result of synchronizing one domain object.
 */
public sealed interface SyncOutcome {

    DomainObjectRef ref();

    /**
     * The store now holds the canonical set. {@code drifted} is set when a reconciliation
     * found the store diverged before repairing it.
     */
    record Applied(DomainObjectRef ref, int added, int removed, int attempts, boolean drifted) implements SyncOutcome {

        public boolean changed() {
            return added > 0 || removed > 0;
        }
    }

    record Failed(DomainObjectRef ref, SyncError error) implements SyncOutcome {
    }

    record Skipped(DomainObjectRef ref, String reason) implements SyncOutcome {
    }

    static SyncOutcome applied(DomainObjectRef ref, int added, int removed, int attempts) {
        return new Applied(ref, added, removed, attempts, false);
    }

    static SyncOutcome failed(DomainObjectRef ref, SyncError error) {
        return new Failed(ref, error);
    }

    static SyncOutcome skipped(DomainObjectRef ref, String reason) {
        return new Skipped(ref, reason);
    }

    default boolean isSuccess() {
        return this instanceof Applied || this instanceof Skipped;
    }
}
