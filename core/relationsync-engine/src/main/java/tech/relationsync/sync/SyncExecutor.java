package tech.relationsync.sync;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.relationsync.config.RelationSyncConfig;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.Relationship;
import tech.relationsync.model.RelationshipDelta;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.store.RelationStoreException;
import tech.relationsync.store.RelationshipFilter;
import tech.relationsync.store.RelationshipStore;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies deltas to the relationship store.
 *
 * <p>A delta is one logical batch, split into chunks of at most {@code batchSize} tuples.
 * Every addition chunk is confirmed before the first removal chunk is sent, so a principal
 * never loses access it keeps across the change. Additions use {@code touch=true} and removals
 * are delete-if-exists, so any chunk can be re-sent safely.
 *
 * <p>Transient failures are retried with exponential backoff; a retry resumes at the first
 * unconfirmed chunk. Rejections are not retried.
 */
@ApplicationScoped
public class SyncExecutor {

    private static final Logger LOG = Logger.getLogger(SyncExecutor.class);

    private final RelationshipStore store;
    private final int batchSize;
    private final RetryConfig retryConfig;

    @Inject
    public SyncExecutor(RelationshipStore store, RelationSyncConfig config) {
        this(store, config.store().batchSize(), retryConfig(config.retry()));
    }

    public SyncExecutor(RelationshipStore store, int batchSize, RetryConfig retryConfig) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.store = store;
        this.batchSize = batchSize;
        this.retryConfig = retryConfig;
    }

    static RetryConfig retryConfig(RelationSyncConfig.Retry retry) {
        return RetryConfig.custom()
            .maxAttempts(retry.maxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                retry.initialBackoff().toMillis(), retry.multiplier(), retry.maxBackoff().toMillis()))
            .retryExceptions(RelationStoreException.Unavailable.class)
            .ignoreExceptions(RelationStoreException.Rejected.class, RelationStoreException.Conflict.class)
            .build();
    }

    /**
     * Apply a delta for one domain object.
     *
     * @return {@link SyncOutcome.Applied} once every chunk is confirmed, otherwise
     *         {@link SyncOutcome.Failed} with {@link SyncError.Unavailable} or {@link SyncError.Rejected}
     */
    public SyncOutcome apply(DomainObjectRef ref, RelationshipDelta delta) {
        if (delta.isEmpty()) {
            return SyncOutcome.applied(ref, 0, 0, 0);
        }

        PendingWrites pending = new PendingWrites(delta, batchSize);
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = Retry.of("relation-sync-" + ref, retryConfig);
        retry.getEventPublisher().onRetry(event -> LOG.warnf(
            "Retrying %s after transient failure (attempt %d): %s",
            ref, event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));

        try {
            retry.executeRunnable(() -> {
                attempts.incrementAndGet();
                pending.drain(store);
            });
        } catch (RelationStoreException.Unavailable e) {
            LOG.errorf("Giving up on %s after %d attempts: %s", ref, attempts.get(), e.getMessage());
            return SyncOutcome.failed(ref, new SyncError.Unavailable(e.getMessage(), attempts.get()));
        } catch (RelationStoreException.Rejected | RelationStoreException.Conflict e) {
            return SyncOutcome.failed(ref, rejected(ref, pending, e));
        }

        LOG.debugf("Applied %s to %s in %d attempt(s)", delta, ref, attempts.get());
        return SyncOutcome.applied(ref, delta.additions().size(), delta.removals().size(), attempts.get());
    }

    /**
     * Read what the store currently holds for a set of filters, with the same retry policy.
     */
    public RelationshipSet readActual(List<RelationshipFilter> filters) {
        Retry retry = Retry.of("relation-sync-read", retryConfig);
        return retry.executeSupplier(() -> {
            RelationshipSet.Builder actual = RelationshipSet.builder();
            for (RelationshipFilter filter : filters) {
                actual.addAll(store.readRelationships(filter));
            }
            return actual.build();
        });
    }

    /**
     * Delete tuples that belong to no domain object, chunked and retried like a delta.
     *
     * @throws RelationStoreException if the store stays unavailable or rejects a chunk
     */
    public void deleteAll(RelationshipSet tuples) {
        if (tuples.isEmpty()) {
            return;
        }
        PendingWrites pending = new PendingWrites(new RelationshipDelta(RelationshipSet.empty(), tuples), batchSize);
        Retry retry = Retry.of("relation-sync-unowned", retryConfig);
        retry.executeRunnable(() -> pending.drain(store));
    }

    /**
     * Name the tuple behind a rejection. If the store did not say which one it was, re-send the
     * head chunk one tuple at a time until the store rejects a single tuple.
     */
    private SyncError rejected(DomainObjectRef ref, PendingWrites pending, RelationStoreException cause) {
        Optional<Relationship> offending = cause instanceof RelationStoreException.Rejected rejected
            ? rejected.getOffending()
            : Optional.empty();

        if (offending.isEmpty() && pending.headSize() > 1) {
            try {
                offending = pending.isolateRejected(store);
            } catch (RelationStoreException e) {
                LOG.warnf("Could not isolate rejected tuple for %s: %s", ref, e.getMessage());
            }
        }

        LOG.errorf("Relationship store rejected delta for %s%s: %s", ref,
            offending.map(r -> " at " + r).orElse(""), cause.getMessage());
        return new SyncError.Rejected(offending, cause.getMessage());
    }

    /**
     * Chunks still to be confirmed, additions first. Confirmed chunks are dropped,
     * so re-draining after a failure resumes where the last attempt stopped.
     */
    static final class PendingWrites {

        private final Deque<Chunk> chunks = new ArrayDeque<>();

        PendingWrites(RelationshipDelta delta, int batchSize) {
            split(delta.additions(), true, batchSize);
            split(delta.removals(), false, batchSize);
        }

        private void split(RelationshipSet tuples, boolean write, int batchSize) {
            List<Relationship> all = tuples.asList();
            for (int from = 0; from < all.size(); from += batchSize) {
                chunks.addLast(new Chunk(write, all.subList(from, Math.min(from + batchSize, all.size()))));
            }
        }

        void drain(RelationshipStore store) {
            while (!chunks.isEmpty()) {
                Chunk chunk = chunks.peekFirst();
                chunk.send(store);
                chunks.pollFirst();
            }
        }

        int headSize() {
            Chunk head = chunks.peekFirst();
            return head == null ? 0 : head.tuples().size();
        }

        int remainingChunks() {
            return chunks.size();
        }

        Optional<Relationship> isolateRejected(RelationshipStore store) {
            Chunk head = chunks.peekFirst();
            if (head == null) {
                return Optional.empty();
            }
            for (Relationship tuple : head.tuples()) {
                try {
                    new Chunk(head.write(), List.of(tuple)).send(store);
                } catch (RelationStoreException.Rejected | RelationStoreException.Conflict e) {
                    return Optional.of(tuple);
                }
            }
            return Optional.empty();
        }
    }

    record Chunk(boolean write, List<Relationship> tuples) {

        void send(RelationshipStore store) {
            if (write) {
                store.writeRelationships(true, tuples);
            } else {
                store.deleteRelationships(tuples);
            }
        }
    }
}
