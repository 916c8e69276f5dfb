package tech.relationsync.reconcile;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.relationsync.config.RelationSyncConfig;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.rbac.RbacStateSource;
import tech.relationsync.record.SyncRecordRepository;
import tech.relationsync.store.RelationStoreException;
import tech.relationsync.sync.SyncDispatcher;
import tech.relationsync.sync.SyncExecutor;
import tech.relationsync.sync.SyncOutcome;
import tech.relationsync.sync.SyncRequest;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Periodically compares what the relationship store holds against the canonical sets and
 * repairs the difference.
 *
 * <p>Candidates are every live RBAC object plus every object with a sync record, so objects
 * deleted while no change notification got through are cleaned up too. Reconciliation goes
 * through the same per-object queues as live changes and never races them.
 *
 * <p>Once every object is back in line, a final sweep removes tuples of the engine's own shapes
 * that no object owns. The sweep is skipped after any failure, since a failed object's tuples
 * would look unowned.
 */
@ApplicationScoped
public class Reconciler {

    private static final Logger LOG = Logger.getLogger(Reconciler.class);

    private final RbacStateSource stateSource;
    private final SyncRecordRepository records;
    private final SyncDispatcher dispatcher;
    private final UnownedTupleSweeper sweeper;
    private final RelationSyncConfig config;

    @Inject
    public Reconciler(RbacStateSource stateSource, SyncRecordRepository records,
                      SyncDispatcher dispatcher, SyncExecutor executor, RelationSyncConfig config) {
        this.stateSource = stateSource;
        this.records = records;
        this.dispatcher = dispatcher;
        this.sweeper = new UnownedTupleSweeper(executor, records);
        this.config = config;
    }

    @Scheduled(every = "${relation-sync.reconcile.interval:15m}",
               delayed = "${relation-sync.reconcile.interval:15m}",
               concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledReconcile() {
        if (!config.enabled() || !config.reconcile().enabled()) {
            return;
        }
        try {
            forceReconcileAll();
        } catch (Exception e) {
            LOG.errorf(e, "Reconciliation pass failed");
        }
    }

    /**
     * Reconcile one object now, serialized with any live sync of the same object.
     */
    public CompletableFuture<SyncOutcome> forceReconcile(DomainObjectRef ref) {
        if (!config.enabled()) {
            return CompletableFuture.completedFuture(SyncOutcome.skipped(ref, "replication disabled"));
        }
        return dispatcher.submit(SyncRequest.reconcile(ref));
    }

    /**
     * Reconcile every known object and wait for the pass to finish.
     */
    public ReconciliationSummary forceReconcileAll() {
        Set<DomainObjectRef> candidates = new LinkedHashSet<>(stateSource.listDomainObjects());
        for (SyncRecord record : records.findAll()) {
            candidates.add(record.ref());
        }
        LOG.infof("Starting reconciliation of %d domain objects", candidates.size());

        Map<DomainObjectRef, CompletableFuture<SyncOutcome>> pending = new LinkedHashMap<>();
        for (DomainObjectRef ref : candidates) {
            pending.put(ref, forceReconcile(ref));
        }

        int repaired = 0;
        int failed = 0;
        int skipped = 0;
        for (Map.Entry<DomainObjectRef, CompletableFuture<SyncOutcome>> entry : pending.entrySet()) {
            SyncOutcome outcome;
            try {
                outcome = entry.getValue().join();
            } catch (CompletionException e) {
                failed++;
                LOG.errorf(e.getCause(), "Reconciliation of %s threw", entry.getKey());
                continue;
            }
            if (outcome instanceof SyncOutcome.Applied applied) {
                if (applied.drifted()) {
                    repaired++;
                }
            } else if (outcome instanceof SyncOutcome.Failed failure) {
                failed++;
                LOG.warnf("Reconciliation of %s failed: %s", failure.ref(), failure.error().message());
            } else {
                skipped++;
            }
        }

        int unownedRemoved = 0;
        if (config.enabled() && failed == 0) {
            try {
                unownedRemoved = sweeper.sweep();
            } catch (RelationStoreException e) {
                failed++;
                LOG.errorf("Unowned tuple sweep failed: %s", e.getMessage());
            }
        }

        ReconciliationSummary summary = new ReconciliationSummary(candidates.size(), repaired, failed, skipped, unownedRemoved);
        LOG.infof("Reconciliation finished: %d checked, %d repaired, %d failed, %d unowned tuples removed",
            summary.checked(), summary.repaired(), summary.failed(), summary.unownedRemoved());
        return summary;
    }
}
