package tech.relationsync.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.relationsync.config.RelationSyncConfig;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.DomainObjectType;
import tech.relationsync.rbac.ReplicationEventType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for RBAC mutations.
 *
 * <p>A change to one object also resyncs the objects derived from it, so deleting a group
 * removes its bindings and its nesting in other groups as well as its own member tuples.
 * Callers are never blocked on the relationship store and never see its errors as exceptions;
 * the returned future carries the outcome for the changed object.
 */
@ApplicationScoped
public class RelationSyncService {

    private static final Logger LOG = Logger.getLogger(RelationSyncService.class);

    private final SyncDispatcher dispatcher;
    private final DependencyResolver dependencyResolver;
    private final boolean enabled;

    @Inject
    public RelationSyncService(SyncDispatcher dispatcher, DependencyResolver dependencyResolver,
                               RelationSyncConfig config) {
        this(dispatcher, dependencyResolver, config.enabled());
    }

    public RelationSyncService(SyncDispatcher dispatcher, DependencyResolver dependencyResolver, boolean enabled) {
        this.dispatcher = dispatcher;
        this.dependencyResolver = dependencyResolver;
        this.enabled = enabled;
        if (!enabled) {
            LOG.info("Relation replication is disabled; changes will not be synchronized");
        }
    }

    public CompletableFuture<SyncOutcome> onDomainObjectChanged(DomainObjectRef ref) {
        return onDomainObjectChanged(ref, null);
    }

    /**
     * Schedule a sync of {@code ref} and of every object derived from it.
     *
     * @return completes with the outcome for {@code ref} once it and its dependents have been processed
     */
    public CompletableFuture<SyncOutcome> onDomainObjectChanged(DomainObjectRef ref, ReplicationEventType eventType) {
        if (!enabled) {
            return CompletableFuture.completedFuture(SyncOutcome.skipped(ref, "replication disabled"));
        }
        if (eventType != null && !eventType.appliesTo(ref.type())) {
            LOG.warnf("Event %s does not describe a %s, synchronizing %s anyway", eventType, ref.type(), ref);
        }

        List<DomainObjectRef> dependents;
        try {
            dependents = dependencyResolver.dependentsOf(ref);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to resolve dependents of %s, the next reconciliation will cover them", ref);
            dependents = List.of();
        }

        if (ref.type() == DomainObjectType.ROLE && !dependents.isEmpty()) {
            return changeRoleWithDependents(ref, eventType, dependents);
        }

        CompletableFuture<SyncOutcome> primary = dispatcher.submit(SyncRequest.change(ref, eventType));
        CompletableFuture<Void> rest = syncDependents(ref, dependents, eventType);
        return CompletableFuture.allOf(primary, rest)
            .handle((ignored, error) -> primary.join());
    }

    /**
     * Bindings reference a role's scoped sub-roles by id, so a role change can swap the nodes a
     * binding grants. The role's new tuples are written first, then the bindings move over, and
     * only then are the role's old tuples revoked.
     */
    private CompletableFuture<SyncOutcome> changeRoleWithDependents(DomainObjectRef ref, ReplicationEventType eventType,
                                                                   List<DomainObjectRef> dependents) {
        return dispatcher.submit(SyncRequest.grantsOnly(ref, eventType))
            .thenCompose(grants -> {
                if (grants instanceof SyncOutcome.Failed) {
                    LOG.warnf("Could not grant new access for %s, leaving its dependents and revocations to reconciliation", ref);
                    return CompletableFuture.completedFuture(grants);
                }
                return syncDependents(ref, dependents, eventType)
                    .thenCompose(ignored -> dispatcher.submit(SyncRequest.change(ref, eventType)));
            });
    }

    private CompletableFuture<Void> syncDependents(DomainObjectRef ref, List<DomainObjectRef> dependents,
                                                   ReplicationEventType eventType) {
        List<CompletableFuture<?>> all = new ArrayList<>();
        for (DomainObjectRef dependent : dependents) {
            LOG.debugf("Change to %s also affects %s", ref, dependent);
            all.add(dispatcher.submit(SyncRequest.change(dependent, eventType))
                .exceptionally(e -> {
                    LOG.errorf(e, "Dependent sync of %s failed", dependent);
                    return null;
                }));
        }
        return CompletableFuture.allOf(all.toArray(new CompletableFuture<?>[0]));
    }

    void onDomainObjectChanged(@Observes DomainObjectChanged event) {
        onDomainObjectChanged(event.ref(), event.eventType());
    }
}
