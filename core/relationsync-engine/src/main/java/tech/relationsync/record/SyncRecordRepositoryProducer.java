package tech.relationsync.record;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.relationsync.config.RecordStoreType;
import tech.relationsync.config.RelationSyncConfig;
import tech.relationsync.record.jdbc.JdbcSyncRecordRepository;
import tech.relationsync.record.memory.InMemorySyncRecordRepository;

/**
 * CDI producer that selects the SyncRecordRepository implementation
 * based on the configured record store type.
 */
@ApplicationScoped
public class SyncRecordRepositoryProducer {

    private static final Logger LOG = Logger.getLogger(SyncRecordRepositoryProducer.class);

    @Inject
    RelationSyncConfig config;

    @Inject
    Instance<JdbcSyncRecordRepository> jdbcRepo;

    @Inject
    Instance<InMemorySyncRecordRepository> inMemoryRepo;

    @Produces
    @ApplicationScoped
    public SyncRecordRepository produceRepository() {
        RecordStoreType type = config.recordStore();
        LOG.infof("Configuring SyncRecordRepository for record store type: %s", type);

        SyncRecordRepository repository = switch (type) {
            case JDBC -> {
                if (!jdbcRepo.isResolvable()) {
                    throw new IllegalStateException(
                        "JDBC sync record repository not available. Ensure a datasource is configured.");
                }
                yield jdbcRepo.get();
            }
            case IN_MEMORY -> inMemoryRepo.get();
        };
        repository.createSchema();
        return repository;
    }
}
