package tech.relationsync.config;

/**
 * Backing store for sync records.
 */
public enum RecordStoreType {
    JDBC,
    IN_MEMORY
}
