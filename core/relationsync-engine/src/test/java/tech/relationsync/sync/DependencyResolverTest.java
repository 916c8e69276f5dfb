package tech.relationsync.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.Relationship;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.rbac.RbacStateSource;
import tech.relationsync.record.memory.InMemorySyncRecordRepository;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DependencyResolverTest {

    @Mock
    RbacStateSource stateSource;

    private final InMemorySyncRecordRepository records = new InMemorySyncRecordRepository();
    private DependencyResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DependencyResolver(stateSource, records);
    }

    private void recordSynced(DomainObjectRef ref, String... tuples) {
        RelationshipSet.Builder set = RelationshipSet.builder();
        for (String tuple : tuples) {
            set.add(Relationship.parse(tuple));
        }
        Instant now = Instant.now();
        records.save(SyncRecord.unsynced(ref, now).syncing(now).synced(set.build(), now));
    }

    @Test
    void shouldCombineLiveDependentsWithRecordedOnes() {
        // Given - the RBAC store still knows one binding, the records know the other and a parent group
        DomainObjectRef group = DomainObjectRef.group("G1");
        when(stateSource.findDependents(group)).thenReturn(List.of(DomainObjectRef.roleBinding("G1", "R1")));
        recordSynced(DomainObjectRef.roleBinding("G1", "R2"), "role_binding:b2#subject@group:G1#member");
        recordSynced(DomainObjectRef.roleBinding("G9", "R1"), "role_binding:b9#subject@group:G9#member");
        recordSynced(DomainObjectRef.group("G0"), "group:G0#member@group:G1#member");
        recordSynced(DomainObjectRef.group("G5"), "group:G5#member@user:alice");

        // When
        List<DomainObjectRef> dependents = resolver.dependentsOf(group);

        // Then
        assertThat(dependents).containsExactlyInAnyOrder(
            DomainObjectRef.roleBinding("G1", "R1"),
            DomainObjectRef.roleBinding("G1", "R2"),
            DomainObjectRef.group("G0"));
    }

    @Test
    void shouldFindCrossAccountRequestsOfADeletedRole() {
        DomainObjectRef role = DomainObjectRef.role("R1");
        when(stateSource.findDependents(role)).thenReturn(List.of());
        recordSynced(DomainObjectRef.crossAccountRequest("req-1"), "rbac/v1role:R1#binding@role_binding:b1");
        recordSynced(DomainObjectRef.roleBinding("G1", "R1"), "rbac/v1role:R1#binding@role_binding:b2");

        assertThat(resolver.dependentsOf(role)).containsExactlyInAnyOrder(
            DomainObjectRef.crossAccountRequest("req-1"),
            DomainObjectRef.roleBinding("G1", "R1"));
    }

    @Test
    void shouldFindChildWorkspaces() {
        DomainObjectRef parent = DomainObjectRef.workspace("W1");
        when(stateSource.findDependents(parent)).thenReturn(List.of());
        recordSynced(DomainObjectRef.workspace("W2"), "workspace:W2#parent@workspace:W1");
        recordSynced(DomainObjectRef.workspace("W1"), "workspace:W1#parent@tenant:acme");

        assertThat(resolver.dependentsOf(parent)).containsExactly(DomainObjectRef.workspace("W2"));
    }

    @Test
    void bindingsHaveNoDependents() {
        DomainObjectRef binding = DomainObjectRef.roleBinding("G1", "R1");
        when(stateSource.findDependents(binding)).thenReturn(List.of());

        assertThat(resolver.dependentsOf(binding)).isEmpty();
    }
}
