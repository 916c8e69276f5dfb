package tech.relationsync.record.jdbc;

/**
 * Sync records could not be read or written.
 */
public class SyncRecordStoreException extends RuntimeException {

    public SyncRecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
