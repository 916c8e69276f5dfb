package tech.relationsync.reconcile;

import io.quarkus.scheduler.Scheduled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.Relationship;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.rbac.ReplicationEventType;
import tech.relationsync.sync.SyncOutcome;
import tech.relationsync.support.SyncEngineHarness;

import java.lang.reflect.Method;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static tech.relationsync.support.RbacFixtures.*;

class ReconcilerTest {

    private SyncEngineHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private void givenTwoGroupsHoldingRoleA() {
        harness.rbac.put(roleA())
            .put(group(GROUP_DEV, "user_dev"))
            .put(group(GROUP_OPS, "user_ops"))
            .bind(GROUP_DEV, ROLE_A)
            .bind(GROUP_OPS, ROLE_A);
    }

    @Test
    void shouldPopulateAnEmptyStore() {
        harness = new SyncEngineHarness();
        givenTwoGroupsHoldingRoleA();

        ReconciliationSummary summary = harness.reconciler.forceReconcileAll();

        assertEquals(5, summary.checked());
        assertEquals(5, summary.repaired());
        assertTrue(summary.converged());
        assertEquals(2 + 1 + 1 + 4 + 4, harness.store.contents().size());
    }

    @Test
    void shouldConvergeACorruptedStoreInOnePass() {
        // Given
        harness = new SyncEngineHarness();
        givenTwoGroupsHoldingRoleA();
        harness.reconciler.forceReconcileAll();
        RelationshipSet canonical = harness.store.contents();

        // When - tuples lost and stray ones written behind the engine's back
        String opsBinding = canonical.stream()
            .filter(t -> t.relation().equals("subject") && t.subject().object().id().equals(GROUP_OPS))
            .map(t -> t.object().id())
            .findFirst()
            .orElseThrow();
        Relationship lost = Relationship.parse("cost_management/aws_account:123456#user_grant@role_binding:" + opsBinding);
        harness.store.remove(lost);
        harness.store.remove(Relationship.parse("group:" + GROUP_OPS + "#member@user:user_ops"));
        harness.store.seed(
            Relationship.parse("group:" + GROUP_DEV + "#member@user:intruder"),
            Relationship.parse("role_binding:stray#subject@group:" + GROUP_DEV + "#member"),
            Relationship.parse("role_binding:stray#granted@role:" + ROLE_A),
            Relationship.parse("workspace:org_default#user_grant@role_binding:stray"));
        ReconciliationSummary summary = harness.reconciler.forceReconcileAll();

        // Then
        assertTrue(summary.converged());
        assertEquals(4, summary.repaired(), "both groups and both bindings drifted");
        assertEquals(canonical, harness.store.contents());

        ReconciliationSummary second = harness.reconciler.forceReconcileAll();
        assertEquals(0, second.repaired());
    }

    @Test
    void shouldCleanUpObjectsDeletedWithoutNotification() {
        harness = new SyncEngineHarness();
        givenTwoGroupsHoldingRoleA();
        harness.reconciler.forceReconcileAll();

        harness.rbac.deleteGroup(GROUP_DEV);
        ReconciliationSummary summary = harness.reconciler.forceReconcileAll();

        assertTrue(summary.converged());
        assertTrue(harness.store.contents().stream().noneMatch(t ->
            t.subject().object().id().equals(GROUP_DEV) || t.object().id().equals(GROUP_DEV)));
        assertTrue(harness.records.find(DomainObjectRef.group(GROUP_DEV)).isEmpty());
        assertTrue(harness.records.find(DomainObjectRef.roleBinding(GROUP_DEV, ROLE_A)).isEmpty());
        assertEquals(2 + 1 + 4, harness.store.contents().size());
    }

    @Test
    void shouldReportFailuresWhileTheStoreIsDown() {
        harness = new SyncEngineHarness();
        harness.rbac.put(group(GROUP_DEV, "user_dev"));
        harness.store.failNext(1_000);

        ReconciliationSummary summary = harness.reconciler.forceReconcileAll();

        assertEquals(1, summary.failed());
        assertFalse(summary.converged());
    }

    @Test
    void shouldSkipWhenReplicationIsDisabled() throws Exception {
        harness = new SyncEngineHarness(config -> config.enabled = false);
        harness.rbac.put(group(GROUP_DEV, "user_dev"));

        SyncOutcome single = harness.reconciler.forceReconcile(DomainObjectRef.group(GROUP_DEV)).get(5, TimeUnit.SECONDS);
        ReconciliationSummary summary = harness.reconciler.forceReconcileAll();

        assertInstanceOf(SyncOutcome.Skipped.class, single);
        assertEquals(1, summary.skipped());
        assertThat(harness.store.calls()).isEmpty();
    }

    @Test
    void shouldRemoveTuplesNoDomainObjectOwns() {
        // Given - dev holds RoleA and the store is in line
        harness = new SyncEngineHarness();
        harness.rbac.put(roleA()).put(group(GROUP_DEV, "user_dev")).bind(GROUP_DEV, ROLE_A);
        harness.reconciler.forceReconcileAll();
        RelationshipSet canonical = harness.store.contents();

        // When - a binding of a role dev never held, and a group RBAC never had, appear in the store
        Relationship foreign = Relationship.parse("inventory/host:h1#workspace@workspace:org_default");
        harness.store.seed(
            Relationship.parse("role_binding:stray#subject@group:" + GROUP_DEV + "#member"),
            Relationship.parse("role_binding:stray#granted@role:R2"),
            Relationship.parse("workspace:org_default#user_grant@role_binding:stray"),
            Relationship.parse("group:ghost#member@user:mallory"),
            foreign);
        ReconciliationSummary summary = harness.reconciler.forceReconcileAll();

        // Then - every engine-shaped tuple without an owner is gone, other writers' tuples stay
        assertTrue(summary.converged());
        assertEquals(0, summary.repaired(), "no live object drifted");
        assertEquals(4, summary.unownedRemoved());
        assertEquals(canonical.union(RelationshipSet.of(foreign)), harness.store.contents());

        ReconciliationSummary second = harness.reconciler.forceReconcileAll();
        assertEquals(0, second.unownedRemoved());
    }

    @Test
    void shouldLeaveUnownedTuplesAloneWhenAnObjectFailed() {
        harness = new SyncEngineHarness();
        harness.rbac.put(roleA()).bind(GROUP_DEV, ROLE_A, "public");
        Relationship ghost = Relationship.parse("group:ghost#member@user:mallory");
        harness.store.seed(ghost);

        ReconciliationSummary summary = harness.reconciler.forceReconcileAll();

        assertEquals(1, summary.failed());
        assertEquals(0, summary.unownedRemoved());
        assertTrue(harness.store.contents().contains(ghost));
    }

    @Nested
    class ScheduledPass {

        @Test
        void shouldRunEveryConfiguredIntervalWithoutOverlapping() throws Exception {
            Method method = Reconciler.class.getDeclaredMethod("scheduledReconcile");
            Scheduled scheduled = method.getAnnotation(Scheduled.class);

            assertEquals("${relation-sync.reconcile.interval:15m}", scheduled.every());
            assertEquals(Scheduled.ConcurrentExecution.SKIP, scheduled.concurrentExecution());
        }

        @Test
        void shouldApplyAChangeWhoseEventNeverArrivedOnTheNextPass() throws Exception {
            // Given - dev synced through a change event
            harness = new SyncEngineHarness();
            harness.rbac.put(group(GROUP_DEV, "user_dev"));
            harness.service.onDomainObjectChanged(DomainObjectRef.group(GROUP_DEV), ReplicationEventType.CREATE_GROUP)
                .get(5, TimeUnit.SECONDS);

            // When - a member is added but the event is lost
            harness.rbac.put(group(GROUP_DEV, "user_dev", "user_new"));
            Relationship added = Relationship.parse("group:" + GROUP_DEV + "#member@user:user_new");
            assertFalse(harness.store.contents().contains(added));
            harness.reconciler.scheduledReconcile();

            // Then
            assertTrue(harness.store.contents().contains(added));
        }

        @Test
        void shouldNotRunWhenReconciliationIsDisabled() {
            harness = new SyncEngineHarness(config -> config.reconcileEnabled = false);
            harness.rbac.put(group(GROUP_DEV, "user_dev"));

            harness.reconciler.scheduledReconcile();

            assertThat(harness.store.contents()).isEmpty();
            assertTrue(harness.records.findAll().isEmpty());
        }

        @Test
        void shouldNotRunWhenReplicationIsDisabled() {
            harness = new SyncEngineHarness(config -> config.enabled = false);
            harness.rbac.put(group(GROUP_DEV, "user_dev"));

            harness.reconciler.scheduledReconcile();

            assertThat(harness.store.calls()).isEmpty();
            assertTrue(harness.records.findAll().isEmpty());
        }
    }
}
