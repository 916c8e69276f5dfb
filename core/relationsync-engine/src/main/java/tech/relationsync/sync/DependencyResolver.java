package tech.relationsync.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.DomainObjectType;
import tech.relationsync.model.Relationship;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.rbac.RbacStateSource;
import tech.relationsync.record.SyncRecordRepository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static tech.relationsync.model.RelationSchema.*;

/**
 * Finds the other domain objects whose canonical sets must be recomputed after a change.
 *
 * <p>The RBAC store knows live dependents. Sync records cover the rest: once a group or role
 * is deleted the RBAC store may no longer link it to anything, but records still show which
 * objects emitted tuples referencing it.
 */
@ApplicationScoped
public class DependencyResolver {

    private final RbacStateSource stateSource;
    private final SyncRecordRepository records;

    @Inject
    public DependencyResolver(RbacStateSource stateSource, SyncRecordRepository records) {
        this.stateSource = stateSource;
        this.records = records;
    }

    public List<DomainObjectRef> dependentsOf(DomainObjectRef ref) {
        Set<DomainObjectRef> dependents = new LinkedHashSet<>(stateSource.findDependents(ref));
        switch (ref.type()) {
            case GROUP -> {
                fromRecords(DomainObjectType.ROLE_BINDING,
                    r -> r.ref().bindingGroupId().equals(ref.id()), dependents);
                fromRecords(DomainObjectType.GROUP,
                    r -> references(r, t -> isSubject(t, GROUP, ref.id())), dependents);
            }
            case ROLE -> {
                fromRecords(DomainObjectType.ROLE_BINDING,
                    r -> r.ref().bindingRoleId().equals(ref.id()), dependents);
                fromRecords(DomainObjectType.CROSS_ACCOUNT_REQUEST,
                    r -> references(r, t -> V1_ROLE.equals(t.object().type()) && ref.id().equals(t.object().id())),
                    dependents);
            }
            case WORKSPACE -> fromRecords(DomainObjectType.WORKSPACE,
                r -> references(r, t -> isSubject(t, WORKSPACE, ref.id())), dependents);
            case ROLE_BINDING, CROSS_ACCOUNT_REQUEST -> {
                // nothing is derived from these
            }
        }
        dependents.remove(ref);
        return List.copyOf(dependents);
    }

    private void fromRecords(DomainObjectType type, Predicate<SyncRecord> match, Set<DomainObjectRef> into) {
        for (SyncRecord record : records.findByType(type)) {
            if (match.test(record)) {
                into.add(record.ref());
            }
        }
    }

    private static boolean references(SyncRecord record, Predicate<Relationship> match) {
        return record.lastAppliedSet().stream().anyMatch(match);
    }

    private static boolean isSubject(Relationship tuple, String type, String id) {
        return type.equals(tuple.subject().object().type()) && id.equals(tuple.subject().object().id());
    }
}
