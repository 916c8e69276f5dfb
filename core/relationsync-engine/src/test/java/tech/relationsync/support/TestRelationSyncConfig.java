package tech.relationsync.support;

import tech.relationsync.config.RecordStoreType;
import tech.relationsync.config.RelationSyncConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * Plain config values for tests that run without a Quarkus context.
 */
public class TestRelationSyncConfig implements RelationSyncConfig {

    public boolean enabled = true;
    public int workerThreads = 4;
    public int batchSize = 100;
    public int maxAttempts = 3;
    public String baseUrl = "http://localhost:8000/api/rebac/v1";
    public Optional<String> token = Optional.empty();
    public boolean reconcileEnabled = true;

    @Override
    public boolean enabled() {
        return enabled;
    }

    @Override
    public int workerThreads() {
        return workerThreads;
    }

    @Override
    public String publicTenantName() {
        return "public";
    }

    @Override
    public int translationAttempts() {
        return 3;
    }

    @Override
    public RecordStoreType recordStore() {
        return RecordStoreType.IN_MEMORY;
    }

    @Override
    public Store store() {
        return new Store() {
            @Override
            public String baseUrl() {
                return baseUrl;
            }

            @Override
            public Optional<String> token() {
                return token;
            }

            @Override
            public int batchSize() {
                return batchSize;
            }

            @Override
            public Duration requestTimeout() {
                return Duration.ofSeconds(2);
            }

            @Override
            public Duration connectTimeout() {
                return Duration.ofSeconds(1);
            }
        };
    }

    @Override
    public Retry retry() {
        return new Retry() {
            @Override
            public int maxAttempts() {
                return maxAttempts;
            }

            @Override
            public Duration initialBackoff() {
                return Duration.ofMillis(1);
            }

            @Override
            public double multiplier() {
                return 1.5;
            }

            @Override
            public Duration maxBackoff() {
                return Duration.ofMillis(5);
            }
        };
    }

    @Override
    public Reconcile reconcile() {
        return new Reconcile() {
            @Override
            public boolean enabled() {
                return reconcileEnabled;
            }

            @Override
            public String interval() {
                return "15m";
            }
        };
    }
}
