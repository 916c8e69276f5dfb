package tech.relationsync.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Synchronization state of one domain object.
 * Uses integer codes for storage in the sync record table.
 *
 * <p>Status codes:
 * <ul>
 *   <li>0 = UNSYNCED - never applied</li>
 *   <li>1 = SYNCING - a delta is being applied</li>
 *   <li>2 = SYNCED - the store holds exactly the last applied set</li>
 *   <li>3 = FAILED - the last apply did not complete</li>
 * </ul>
 */
public enum SyncStatus {

    UNSYNCED(0),

    SYNCING(1),

    SYNCED(2),

    /**
     * The last applied set is a superset of what may be in the store.
     * Retried on the next mutation or reconciliation pass.
     */
    FAILED(3);

    private final int code;

    SyncStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Whether a record may move from this status to {@code next}.
     */
    public boolean canTransitionTo(SyncStatus next) {
        return allowedNext().contains(next);
    }

    private Set<SyncStatus> allowedNext() {
        return switch (this) {
            case UNSYNCED, SYNCED, FAILED -> EnumSet.of(SYNCING);
            case SYNCING -> EnumSet.of(SYNCED, FAILED);
        };
    }

    public static SyncStatus fromCode(int code) {
        for (SyncStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown sync status code: " + code);
    }
}
