package tech.relationsync.sync;

import org.jboss.logging.Logger;
import tech.relationsync.model.DomainObjectRef;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Serializes syncs for a single domain object.
 *
 * <p>At most one sync is in flight. Requests arriving meanwhile are folded into a single
 * pending follow-up: a newer request supersedes an older one that has not started, and every
 * caller waiting on the superseded request gets the follow-up's outcome. The follow-up always
 * re-reads RBAC state, so it covers every mutation that was coalesced into it.
 */
public class DomainObjectSyncQueue {

    private static final Logger LOG = Logger.getLogger(DomainObjectSyncQueue.class);

    private final DomainObjectRef ref;
    private final Executor executor;
    private final Function<SyncRequest, SyncOutcome> syncFunction;
    private final Runnable onIdle;

    private SyncRequest pendingRequest;
    private List<CompletableFuture<SyncOutcome>> pendingCallers = new ArrayList<>();
    private boolean inFlight;

    public DomainObjectSyncQueue(DomainObjectRef ref, Executor executor,
                                 Function<SyncRequest, SyncOutcome> syncFunction, Runnable onIdle) {
        this.ref = ref;
        this.executor = executor;
        this.syncFunction = syncFunction;
        this.onIdle = onIdle;
    }

    /**
     * Queue a sync. The returned future completes with the outcome of the run that covers it.
     */
    public CompletableFuture<SyncOutcome> submit(SyncRequest request) {
        CompletableFuture<SyncOutcome> caller = new CompletableFuture<>();
        synchronized (this) {
            if (pendingRequest == null) {
                pendingRequest = request;
            } else {
                LOG.debugf("Coalescing pending sync for %s", ref);
                pendingRequest = pendingRequest.supersededBy(request);
            }
            pendingCallers.add(caller);
        }
        tryDispatchNext();
        return caller;
    }

    private void tryDispatchNext() {
        SyncRequest next;
        List<CompletableFuture<SyncOutcome>> callers;
        synchronized (this) {
            if (inFlight || pendingRequest == null) {
                return;
            }
            inFlight = true;
            next = pendingRequest;
            callers = pendingCallers;
            pendingRequest = null;
            pendingCallers = new ArrayList<>();
        }

        try {
            executor.execute(() -> run(next, callers));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to schedule sync for %s", ref);
            synchronized (this) {
                inFlight = false;
            }
            callers.forEach(c -> c.completeExceptionally(e));
        }
    }

    private void run(SyncRequest request, List<CompletableFuture<SyncOutcome>> callers) {
        SyncOutcome outcome = null;
        RuntimeException failure = null;
        try {
            outcome = syncFunction.apply(request);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error synchronizing %s", ref);
            failure = e;
        } finally {
            synchronized (this) {
                inFlight = false;
            }
        }

        for (CompletableFuture<SyncOutcome> caller : callers) {
            if (failure != null) {
                caller.completeExceptionally(failure);
            } else {
                caller.complete(outcome);
            }
        }

        tryDispatchNext();
        if (isIdle()) {
            onIdle.run();
        }
    }

    public synchronized boolean isIdle() {
        return !inFlight && pendingRequest == null;
    }

    public synchronized boolean hasPending() {
        return pendingRequest != null;
    }

    public synchronized boolean isInFlight() {
        return inFlight;
    }

    public DomainObjectRef getRef() {
        return ref;
    }
}
