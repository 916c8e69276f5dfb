package tech.relationsync.record;

import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.DomainObjectType;
import tech.relationsync.model.SyncRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for sync records, one per domain object that owns tuples.
 */
public interface SyncRecordRepository {

    Optional<SyncRecord> find(DomainObjectRef ref);

    List<SyncRecord> findAll();

    List<SyncRecord> findByType(DomainObjectType type);

    /**
     * Insert or replace the record for {@code record.ref()}.
     */
    void save(SyncRecord record);

    void delete(DomainObjectRef ref);

    /**
     * Create backing tables if they don't exist. Idempotent.
     */
    default void createSchema() {
    }
}
