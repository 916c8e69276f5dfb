package tech.relationsync.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.relationsync.config.RelationSyncConfig;
import tech.relationsync.diff.RelationshipDiffer;
import tech.relationsync.metrics.SyncMetrics;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.RelationshipDelta;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.model.SyncStatus;
import tech.relationsync.rbac.DomainObjectState;
import tech.relationsync.rbac.RbacStateSource;
import tech.relationsync.record.SyncRecordRepository;
import tech.relationsync.store.RelationStoreException;
import tech.relationsync.translate.IncompleteDomainStateException;
import tech.relationsync.translate.RelationTranslator;
import tech.relationsync.translate.TranslationException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs one sync for one domain object: load, translate, diff, apply, record.
 *
 * <p>Callers guarantee that at most one sync per object runs at a time (see {@link SyncDispatcher}).
 *
 * <p>Sync record handling:
 * <ol>
 *   <li>The record moves to SYNCING before anything is sent to the store, already holding the
 *       additions about to be written</li>
 *   <li>On success it holds the new canonical set and moves to SYNCED; a deleted object's record is removed</li>
 *   <li>On failure it holds the previous set plus the attempted additions, since any of those may
 *       have landed, and moves to FAILED so the next trigger removes what should not be there</li>
 * </ol>
 */
@ApplicationScoped
public class DomainObjectSynchronizer {

    private static final Logger LOG = Logger.getLogger(DomainObjectSynchronizer.class);

    private final RbacStateSource stateSource;
    private final RelationTranslator translator;
    private final SyncRecordRepository records;
    private final SyncExecutor executor;
    private final SyncMetrics metrics;
    private final int translationAttempts;
    private final RelationOwnership ownership;

    @Inject
    public DomainObjectSynchronizer(RbacStateSource stateSource, RelationTranslator translator,
                                    SyncRecordRepository records, SyncExecutor executor,
                                    SyncMetrics metrics, RelationSyncConfig config) {
        this(stateSource, translator, records, executor, metrics, config.translationAttempts());
    }

    public DomainObjectSynchronizer(RbacStateSource stateSource, RelationTranslator translator,
                                    SyncRecordRepository records, SyncExecutor executor,
                                    SyncMetrics metrics, int translationAttempts) {
        this.stateSource = stateSource;
        this.translator = translator;
        this.records = records;
        this.executor = executor;
        this.metrics = metrics;
        this.translationAttempts = Math.max(1, translationAttempts);
        this.ownership = new RelationOwnership(filter -> executor.readActual(List.of(filter)).asList());
    }

    public SyncOutcome synchronize(SyncRequest request) {
        DomainObjectRef ref = request.ref();
        Instant started = Instant.now();

        Canonical canonical;
        try {
            canonical = loadCanonical(ref);
        } catch (IncompleteDomainStateException e) {
            LOG.warnf("RBAC state for %s still incomplete after %d reads: %s", ref, translationAttempts, e.getMessage());
            return failUntranslated(ref, new SyncError.IncompleteState(e.getMessage()), started);
        } catch (TranslationException e) {
            LOG.errorf("Cannot translate %s: %s", ref, e.getMessage());
            return failUntranslated(ref, new SyncError.Untranslatable(e.getMessage()), started);
        }

        Optional<SyncRecord> existing = records.find(ref);
        if (canonical.deleted() && existing.isEmpty() && request.mode() != SyncMode.RECONCILE) {
            LOG.debugf("%s is gone and was never synced, nothing to remove", ref);
            return SyncOutcome.applied(ref, 0, 0, 0);
        }
        SyncRecord record = existing.orElseGet(() -> SyncRecord.unsynced(ref, started));

        SyncMode mode = request.mode();
        if (record.status() == SyncStatus.SYNCING) {
            // left behind by a process that stopped mid-apply; its additions may or may not have landed
            LOG.warnf("Found interrupted sync for %s, reading store contents", ref);
            record = record.failed(record.lastAppliedSet(), "Interrupted while syncing", started);
            mode = SyncMode.RECONCILE;
        }

        RelationshipSet previous = record.lastAppliedSet();
        boolean drifted = false;
        if (mode == SyncMode.RECONCILE) {
            RelationshipSet actual;
            try {
                actual = ownership.discover(ref, canonical.tuples().union(previous));
            } catch (RelationStoreException e) {
                LOG.warnf("Could not read store contents for %s: %s", ref, e.getMessage());
                return fail(ref, new SyncError.Unavailable(e.getMessage(), 0), started);
            }
            drifted = !actual.equals(canonical.tuples());
            if (drifted) {
                LOG.warnf("Drift detected for %s: store holds %d tuples, canonical set has %d",
                    ref, actual.size(), canonical.tuples().size());
                metrics.recordDrift(ref.type());
            }
            previous = actual;
        }

        RelationshipDelta delta = RelationshipDiffer.diff(previous, canonical.tuples());
        boolean grantsOnly = mode == SyncMode.GRANTS_ONLY;
        if (grantsOnly) {
            delta = new RelationshipDelta(delta.additions(), RelationshipSet.empty());
        }
        RelationshipSet possiblyPresent = previous.union(delta.additions());
        SyncRecord syncing = record.syncing(possiblyPresent, Instant.now());
        records.save(syncing);

        SyncOutcome outcome = executor.apply(ref, delta);
        Duration elapsed = Duration.between(started, Instant.now());

        if (outcome instanceof SyncOutcome.Applied applied) {
            if (grantsOnly) {
                records.save(syncing.synced(possiblyPresent, Instant.now()));
            } else if (canonical.deleted()) {
                records.delete(ref);
            } else {
                records.save(syncing.synced(canonical.tuples(), Instant.now()));
            }
            metrics.recordApplied(ref.type(), applied.added(), applied.removed(), elapsed);
            if (applied.changed()) {
                LOG.infof("Synchronized %s (%s): %s in %d attempt(s)",
                    ref, request.eventType(), delta, applied.attempts());
            }
            return new SyncOutcome.Applied(ref, applied.added(), applied.removed(), applied.attempts(), drifted);
        }

        SyncOutcome.Failed failed = (SyncOutcome.Failed) outcome;
        records.save(syncing.failed(possiblyPresent, failed.error().message(), Instant.now()));
        metrics.recordFailed(ref.type(), failed.error().kind(), elapsed);
        return failed;
    }

    /**
     * Load and translate, re-reading while the snapshot references objects not yet visible.
     */
    private Canonical loadCanonical(DomainObjectRef ref) {
        IncompleteDomainStateException last = null;
        for (int attempt = 1; attempt <= translationAttempts; attempt++) {
            Optional<DomainObjectState> state = stateSource.load(ref);
            if (state.isEmpty()) {
                return new Canonical(RelationshipSet.empty(), true);
            }
            try {
                return new Canonical(translator.translate(state.get()), false);
            } catch (IncompleteDomainStateException e) {
                last = e;
                LOG.debugf("Incomplete RBAC state for %s on read %d: %s", ref, attempt, e.getMessage());
            }
        }
        throw last;
    }

    /**
     * Nothing was sent, but an existing record is marked FAILED so the object no longer looks
     * healthy while the store still holds its previous tuples.
     */
    private SyncOutcome failUntranslated(DomainObjectRef ref, SyncError error, Instant started) {
        records.find(ref).ifPresent(record -> {
            Instant now = Instant.now();
            SyncRecord attempt = record.status() == SyncStatus.SYNCING ? record : record.syncing(now);
            records.save(attempt.failed(record.lastAppliedSet(), error.message(), now));
        });
        return fail(ref, error, started);
    }

    private SyncOutcome fail(DomainObjectRef ref, SyncError error, Instant started) {
        metrics.recordFailed(ref.type(), error.kind(), Duration.between(started, Instant.now()));
        return SyncOutcome.failed(ref, error);
    }

    private record Canonical(RelationshipSet tuples, boolean deleted) {
    }
}
