package tech.relationsync.admin;

import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.DomainObjectType;
import tech.relationsync.model.Relationship;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.reconcile.ReconciliationSummary;
import tech.relationsync.reconcile.Reconciler;
import tech.relationsync.record.SyncRecordRepository;
import tech.relationsync.sync.RelationSyncService;
import tech.relationsync.sync.SyncOutcome;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Admin API for triggering syncs and reconciliation by hand and inspecting sync records.
 */
@Path("/api/admin/relations")
@Tag(name = "Relation Sync Admin", description = "Trigger synchronization and reconciliation of relationship tuples")
@Produces(MediaType.APPLICATION_JSON)
public class RelationSyncAdminResource {

    private static final Logger LOG = Logger.getLogger(RelationSyncAdminResource.class);

    @Inject
    RelationSyncService syncService;

    @Inject
    Reconciler reconciler;

    @Inject
    SyncRecordRepository records;

    @POST
    @Path("/sync/{type}/{id: .+}")
    @Blocking
    @Operation(summary = "Synchronize one domain object and its dependents")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Sync finished, see outcome"),
        @APIResponse(responseCode = "400", description = "Unknown domain object type")
    })
    public CompletionStage<Response> sync(@PathParam("type") String type, @PathParam("id") String id) {
        DomainObjectRef ref = parseRef(type, id);
        LOG.infof("Manual sync requested for %s", ref);
        return syncService.onDomainObjectChanged(ref)
            .thenApply(outcome -> Response.ok(SyncOutcomeResponse.from(outcome)).build());
    }

    @POST
    @Path("/reconcile/{type}/{id: .+}")
    @Blocking
    @Operation(summary = "Compare one object's stored tuples with its canonical set and repair drift")
    public CompletionStage<Response> reconcile(@PathParam("type") String type, @PathParam("id") String id) {
        DomainObjectRef ref = parseRef(type, id);
        LOG.infof("Manual reconciliation requested for %s", ref);
        return reconciler.forceReconcile(ref)
            .thenApply(outcome -> Response.ok(SyncOutcomeResponse.from(outcome)).build());
    }

    @POST
    @Path("/reconcile")
    @Operation(summary = "Run a full reconciliation pass and wait for it to finish")
    public Response reconcileAll() {
        LOG.info("Manual full reconciliation requested");
        ReconciliationSummary summary = reconciler.forceReconcileAll();
        return Response.ok(summary).build();
    }

    @GET
    @Path("/records/{type}/{id: .+}")
    @Operation(summary = "Get the sync record of a domain object")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Sync record found"),
        @APIResponse(responseCode = "404", description = "Object has never been synchronized")
    })
    public Response getRecord(@PathParam("type") String type, @PathParam("id") String id) {
        DomainObjectRef ref = parseRef(type, id);
        return records.find(ref)
            .map(record -> Response.ok(SyncRecordResponse.from(record)).build())
            .orElse(Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse("No sync record for " + ref))
                .build());
    }

    private static DomainObjectRef parseRef(String type, String id) {
        DomainObjectType objectType;
        try {
            objectType = DomainObjectType.fromPath(type);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse("Unknown domain object type: " + type))
                .build());
        }
        return new DomainObjectRef(objectType, id);
    }

    // ========================================================================
    // DTOs
    // ========================================================================

    public record ErrorResponse(String error) {
    }

    public record SyncOutcomeResponse(
        String type,
        String id,
        String status,
        int added,
        int removed,
        int attempts,
        boolean drifted,
        String error
    ) {
        static SyncOutcomeResponse from(SyncOutcome outcome) {
            DomainObjectRef ref = outcome.ref();
            if (outcome instanceof SyncOutcome.Applied applied) {
                return new SyncOutcomeResponse(ref.type().name(), ref.id(), "APPLIED",
                    applied.added(), applied.removed(), applied.attempts(), applied.drifted(), null);
            } else if (outcome instanceof SyncOutcome.Failed failed) {
                return new SyncOutcomeResponse(ref.type().name(), ref.id(), "FAILED",
                    0, 0, 0, false, failed.error().kind() + ": " + failed.error().message());
            }
            SyncOutcome.Skipped skipped = (SyncOutcome.Skipped) outcome;
            return new SyncOutcomeResponse(ref.type().name(), ref.id(), "SKIPPED", 0, 0, 0, false, skipped.reason());
        }
    }

    public record SyncRecordResponse(
        String type,
        String id,
        String status,
        List<String> tuples,
        Instant lastSyncedAt,
        String lastError,
        Instant updatedAt
    ) {
        static SyncRecordResponse from(SyncRecord record) {
            return new SyncRecordResponse(
                record.ref().type().name(),
                record.ref().id(),
                record.status().name(),
                record.lastAppliedSet().stream().map(Relationship::toString).toList(),
                record.lastSyncedAt(),
                record.lastError(),
                record.updatedAt());
        }
    }
}
