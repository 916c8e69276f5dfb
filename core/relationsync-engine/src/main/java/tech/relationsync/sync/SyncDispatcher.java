package tech.relationsync.sync;

import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.relationsync.config.RelationSyncConfig;
import tech.relationsync.model.DomainObjectRef;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Routes sync requests to per-object queues running on a shared worker pool.
 *
 * <p>Syncs for one object never overlap; distinct objects proceed concurrently up to the
 * number of worker threads. Idle queues are dropped.
 */
@ApplicationScoped
public class SyncDispatcher {

    private static final Logger LOG = Logger.getLogger(SyncDispatcher.class);

    private final Map<DomainObjectRef, DomainObjectSyncQueue> queues = new ConcurrentHashMap<>();
    private final Function<SyncRequest, SyncOutcome> syncFunction;
    private final ExecutorService workers;

    @Inject
    public SyncDispatcher(DomainObjectSynchronizer synchronizer, RelationSyncConfig config) {
        this(synchronizer::synchronize, config.workerThreads());
    }

    public SyncDispatcher(Function<SyncRequest, SyncOutcome> syncFunction, int workerThreads) {
        this.syncFunction = syncFunction;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), r -> {
            Thread t = new Thread(r, "relation-sync-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        LOG.infof("SyncDispatcher initialized with %d worker threads", Math.max(1, workerThreads));
    }

    /**
     * Submit a sync; returns when the request is queued, not when it has run.
     */
    public CompletableFuture<SyncOutcome> submit(SyncRequest request) {
        DomainObjectRef ref = request.ref();
        AtomicReference<CompletableFuture<SyncOutcome>> result = new AtomicReference<>();
        // compute() keeps queue creation, submission and idle removal atomic per object
        queues.compute(ref, (key, queue) -> {
            DomainObjectSyncQueue target = queue != null
                ? queue
                : new DomainObjectSyncQueue(key, workers, this::runWithContext, () -> removeIfIdle(key));
            result.set(target.submit(request));
            return target;
        });
        return result.get();
    }

    /**
     * Number of objects with a sync queued or running.
     */
    public int getActiveObjectCount() {
        return queues.size();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        shutdown();
    }

    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warnf("Sync workers did not finish within 30s, %d objects still active", queues.size());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private SyncOutcome runWithContext(SyncRequest request) {
        MDC.put("domainObject", request.ref().toString());
        try {
            return syncFunction.apply(request);
        } finally {
            MDC.remove("domainObject");
        }
    }

    private void removeIfIdle(DomainObjectRef ref) {
        queues.computeIfPresent(ref, (key, queue) -> queue.isIdle() ? null : queue);
    }
}
