package tech.relationsync.record.memory;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.DomainObjectType;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.record.SyncRecordRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local sync records. Lost on restart, after which the first reconciliation
 * pass rebuilds them from the store's actual contents.
 */
@ApplicationScoped
@Typed(InMemorySyncRecordRepository.class)
public class InMemorySyncRecordRepository implements SyncRecordRepository {

    private static final Comparator<SyncRecord> BY_REF = Comparator
        .comparing((SyncRecord r) -> r.ref().type())
        .thenComparing(r -> r.ref().id());

    private final ConcurrentHashMap<DomainObjectRef, SyncRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncRecord> find(DomainObjectRef ref) {
        return Optional.ofNullable(records.get(ref));
    }

    @Override
    public List<SyncRecord> findAll() {
        return records.values().stream().sorted(BY_REF).toList();
    }

    @Override
    public List<SyncRecord> findByType(DomainObjectType type) {
        return records.values().stream()
            .filter(r -> r.ref().type() == type)
            .sorted(BY_REF)
            .toList();
    }

    @Override
    public void save(SyncRecord record) {
        records.put(record.ref(), record);
    }

    @Override
    public void delete(DomainObjectRef ref) {
        records.remove(ref);
    }
}
