package tech.relationsync.sync;

import tech.relationsync.model.Relationship;

import java.util.Optional;

/**
 * Why a delta could not be applied.
 */
public sealed interface SyncError {

    String message();

    /**
     * Short label for metrics and logs.
     */
    String kind();

    /**
     * The store stayed unreachable through every retry.
     */
    record Unavailable(String message, int attempts) implements SyncError {
        @Override
        public String kind() {
            return "unavailable";
        }
    }

    /**
     * The store refused a tuple. Not retried; {@code offending} is empty when the
     * culprit could not be isolated.
     */
    record Rejected(Optional<Relationship> offending, String message) implements SyncError {
        @Override
        public String kind() {
            return "rejected";
        }
    }

    /**
     * RBAC state stayed inconsistent through every re-read.
     */
    record IncompleteState(String message) implements SyncError {
        @Override
        public String kind() {
            return "incomplete_state";
        }
    }

    /**
     * The domain object cannot be expressed as tuples until its RBAC data changes.
     */
    record Untranslatable(String message) implements SyncError {
        @Override
        public String kind() {
            return "untranslatable";
        }
    }
}
