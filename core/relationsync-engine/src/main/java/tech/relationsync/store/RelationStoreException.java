package tech.relationsync.store;

import tech.relationsync.model.Relationship;

import java.util.Optional;

/**
 * Failure talking to the relationship store.
 */
public abstract class RelationStoreException extends RuntimeException {

    protected RelationStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Transient: timeouts, connection errors, 5xx. Safe to retry.
     */
    public static class Unavailable extends RelationStoreException {

        public Unavailable(String message) {
            super(message, null);
        }

        public Unavailable(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Permanent: the store refused the request, e.g. a schema violation.
     */
    public static class Rejected extends RelationStoreException {

        private final Relationship offending;

        public Rejected(String message, Relationship offending) {
            super(message, null);
            this.offending = offending;
        }

        /**
         * The tuple the store named as the cause, if it named one.
         */
        public Optional<Relationship> getOffending() {
            return Optional.ofNullable(offending);
        }
    }

    /**
     * A {@code touch=false} write found a tuple that already exists.
     */
    public static class Conflict extends RelationStoreException {

        public Conflict(String message) {
            super(message, null);
        }
    }
}
