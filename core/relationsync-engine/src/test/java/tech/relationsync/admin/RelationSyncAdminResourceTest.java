package tech.relationsync.admin;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.relationsync.admin.RelationSyncAdminResource.ErrorResponse;
import tech.relationsync.admin.RelationSyncAdminResource.SyncOutcomeResponse;
import tech.relationsync.admin.RelationSyncAdminResource.SyncRecordResponse;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.Relationship;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.rbac.ReplicationEventType;
import tech.relationsync.reconcile.ReconciliationSummary;
import tech.relationsync.reconcile.Reconciler;
import tech.relationsync.record.SyncRecordRepository;
import tech.relationsync.sync.RelationSyncService;
import tech.relationsync.sync.SyncError;
import tech.relationsync.sync.SyncOutcome;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RelationSyncAdminResource with the engine mocked out.
 */
@ExtendWith(MockitoExtension.class)
class RelationSyncAdminResourceTest {

    private static final DomainObjectRef GROUP = DomainObjectRef.group("9aca5b38-07b1-4873-aaae-d02c94c05673");

    @Mock
    RelationSyncService syncService;

    @Mock
    Reconciler reconciler;

    @Mock
    SyncRecordRepository records;

    @InjectMocks
    RelationSyncAdminResource resource;

    @Test
    @DisplayName("Manual sync returns the outcome for the object")
    void sync_shouldReturnAppliedOutcome() {
        when(syncService.onDomainObjectChanged(GROUP))
            .thenReturn(CompletableFuture.completedFuture(SyncOutcome.applied(GROUP, 2, 1, 1)));

        Response response = resource.sync("group", GROUP.id()).toCompletableFuture().join();

        verify(syncService, never()).onDomainObjectChanged(any(), eq(ReplicationEventType.RECONCILE));

        assertThat(response.getStatus()).isEqualTo(200);
        SyncOutcomeResponse body = (SyncOutcomeResponse) response.getEntity();
        assertThat(body.status()).isEqualTo("APPLIED");
        assertThat(body.added()).isEqualTo(2);
        assertThat(body.removed()).isEqualTo(1);
        assertThat(body.error()).isNull();
    }

    @Test
    @DisplayName("Role binding ids containing a slash are accepted")
    void reconcile_shouldAcceptRoleBindingIds() {
        DomainObjectRef binding = DomainObjectRef.roleBinding("g1", "r1");
        when(reconciler.forceReconcile(binding)).thenReturn(CompletableFuture.completedFuture(
            SyncOutcome.failed(binding, new SyncError.Unavailable("store down", 5))));

        Response response = resource.reconcile("role-binding", "g1/r1").toCompletableFuture().join();

        SyncOutcomeResponse body = (SyncOutcomeResponse) response.getEntity();
        assertThat(body.type()).isEqualTo("ROLE_BINDING");
        assertThat(body.status()).isEqualTo("FAILED");
        assertThat(body.error()).isEqualTo("unavailable: store down");
    }

    @Test
    @DisplayName("Unknown object types are a bad request")
    void sync_shouldReturn400_whenTypeIsUnknown() {
        assertThatThrownBy(() -> resource.sync("principal", "alice"))
            .isInstanceOfSatisfying(BadRequestException.class, e -> {
                assertThat(e.getResponse().getStatus()).isEqualTo(400);
                assertThat(((ErrorResponse) e.getResponse().getEntity()).error()).contains("principal");
            });
        verifyNoInteractions(syncService);
    }

    @Test
    void reconcileAll_shouldReturnSummary() {
        when(reconciler.forceReconcileAll()).thenReturn(new ReconciliationSummary(10, 2, 1, 0, 0));

        Response response = resource.reconcileAll();

        assertThat(response.getEntity()).isEqualTo(new ReconciliationSummary(10, 2, 1, 0, 0));
    }

    @Test
    void getRecord_shouldReturnRecord() {
        Relationship member = Relationship.parse("group:" + GROUP.id() + "#member@user:user_dev");
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        SyncRecord record = SyncRecord.unsynced(GROUP, now).syncing(now).synced(RelationshipSet.of(member), now);
        when(records.find(GROUP)).thenReturn(Optional.of(record));

        Response response = resource.getRecord("group", GROUP.id());

        SyncRecordResponse body = (SyncRecordResponse) response.getEntity();
        assertThat(body.status()).isEqualTo("SYNCED");
        assertThat(body.tuples()).containsExactly(member.toString());
        assertThat(body.lastSyncedAt()).isEqualTo(now);
    }

    @Test
    void getRecord_shouldReturn404_whenNeverSynced() {
        when(records.find(GROUP)).thenReturn(Optional.empty());

        Response response = resource.getRecord("group", GROUP.id());

        assertThat(response.getStatus()).isEqualTo(404);
    }
}
