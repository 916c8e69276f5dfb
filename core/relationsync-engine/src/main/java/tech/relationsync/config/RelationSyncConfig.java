package tech.relationsync.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the relation sync engine.
 */
@ConfigMapping(prefix = "relation-sync")
public interface RelationSyncConfig {

    /**
     * Whether changes are replicated to the relationship store at all.
     * When false every change notification is skipped.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Number of domain objects synchronized concurrently.
     */
    @WithDefault("8")
    int workerThreads();

    /**
     * Tenant that roles must never be bound in.
     */
    @WithDefault("public")
    String publicTenantName();

    /**
     * How many times RBAC state is re-read when a snapshot references objects
     * that are not visible yet.
     */
    @WithDefault("3")
    int translationAttempts();

    /**
     * Where sync records are kept: JDBC or IN_MEMORY.
     */
    @WithDefault("JDBC")
    RecordStoreType recordStore();

    Store store();

    Retry retry();

    Reconcile reconcile();

    interface Store {

        /**
         * Relationship store API base URL.
         */
        @WithDefault("http://localhost:8000/api/rebac/v1")
        String baseUrl();

        /**
         * Optional Bearer token for the relationship store.
         */
        Optional<String> token();

        /**
         * Maximum tuples per write or delete request.
         */
        @WithDefault("100")
        int batchSize();

        @WithDefault("10s")
        Duration requestTimeout();

        @WithDefault("5s")
        Duration connectTimeout();
    }

    interface Retry {

        /**
         * Attempts per delta before a transient failure is reported.
         */
        @WithDefault("5")
        int maxAttempts();

        @WithDefault("200ms")
        Duration initialBackoff();

        @WithDefault("2.0")
        double multiplier();

        @WithDefault("10s")
        Duration maxBackoff();
    }

    interface Reconcile {

        @WithDefault("true")
        boolean enabled();

        /**
         * Interval between reconciliation sweeps. Bounds how long drift can persist.
         * Supports duration format: 30s, 15m, etc.
         */
        @WithDefault("15m")
        String interval();
    }
}
