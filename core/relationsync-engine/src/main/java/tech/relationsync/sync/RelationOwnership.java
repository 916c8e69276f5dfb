package tech.relationsync.sync;

import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.ObjectReference;
import tech.relationsync.model.Relationship;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.store.RelationshipFilter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static tech.relationsync.model.RelationSchema.*;

/**
 * Finds the tuples a domain object owns in the store, including ones it should not have.
 *
 * <p>Each object type has anchor tuples that can be read by filter (a group's member tuples,
 * a role's {@code rbac/v1role#role} links, a workspace's parent). Synthetic nodes reached from
 * the anchors or from the known tuple sets (sub-roles, role bindings) are then read in full.
 */
public class RelationOwnership {

    private final Function<RelationshipFilter, List<Relationship>> reader;

    public RelationOwnership(Function<RelationshipFilter, List<Relationship>> reader) {
        this.reader = reader;
    }

    /**
     * Tuples currently in the store that belong to {@code ref}.
     *
     * @param known tuples already attributed to the object: its canonical set and last applied set
     */
    public RelationshipSet discover(DomainObjectRef ref, RelationshipSet known) {
        RelationshipSet.Builder owned = RelationshipSet.builder();
        switch (ref.type()) {
            case GROUP -> owned.addAll(reader.apply(RelationshipFilter.byObject(GROUP, ref.id(), MEMBER)));
            case WORKSPACE -> owned.addAll(reader.apply(RelationshipFilter.byObject(WORKSPACE, ref.id(), PARENT)));
            case ROLE -> discoverRole(ref.id(), known, owned);
            case ROLE_BINDING -> discoverRoleBinding(ref, known, owned);
            case CROSS_ACCOUNT_REQUEST -> {
                for (ObjectReference binding : bindingNodes(known)) {
                    readBindingNode(binding, owned);
                }
            }
        }
        return owned.build();
    }

    private void discoverRole(String roleId, RelationshipSet known, RelationshipSet.Builder owned) {
        List<Relationship> links = reader.apply(RelationshipFilter.byObject(V1_ROLE, roleId, ROLE_RELATION));
        owned.addAll(links);

        Set<ObjectReference> roleNodes = new LinkedHashSet<>();
        links.forEach(link -> roleNodes.add(link.subject().object()));
        known.forEach(tuple -> {
            if (ROLE.equals(tuple.object().type())) {
                roleNodes.add(tuple.object());
            }
        });
        for (ObjectReference role : roleNodes) {
            owned.addAll(reader.apply(RelationshipFilter.byObject(ROLE, role.id())));
        }
    }

    private void discoverRoleBinding(DomainObjectRef ref, RelationshipSet known, RelationshipSet.Builder owned) {
        String groupId = ref.bindingGroupId();
        String roleId = ref.bindingRoleId();

        Set<ObjectReference> knownBindings = bindingNodes(known);
        Set<ObjectReference> candidates = new LinkedHashSet<>(knownBindings);
        reader.apply(new RelationshipFilter(ROLE_BINDING, null, SUBJECT, GROUP, groupId, MEMBER))
            .forEach(tuple -> candidates.add(tuple.object()));

        for (ObjectReference binding : candidates) {
            List<Relationship> tuples = reader.apply(RelationshipFilter.byObject(ROLE_BINDING, binding.id()));
            if (knownBindings.contains(binding) || grantsRoleToGroup(tuples, roleId, groupId)) {
                owned.addAll(tuples);
                owned.addAll(reader.apply(new RelationshipFilter(null, null, null, ROLE_BINDING, binding.id(), null)));
            }
        }
    }

    private void readBindingNode(ObjectReference binding, RelationshipSet.Builder owned) {
        owned.addAll(reader.apply(RelationshipFilter.byObject(ROLE_BINDING, binding.id())));
        owned.addAll(reader.apply(new RelationshipFilter(null, null, null, ROLE_BINDING, binding.id(), null)));
    }

    /**
     * A binding node belongs to (group, role) when it names the group as subject and grants
     * the role itself or one of its scoped sub-roles.
     */
    private static boolean grantsRoleToGroup(List<Relationship> bindingTuples, String roleId, String groupId) {
        boolean subject = bindingTuples.stream().anyMatch(t ->
            SUBJECT.equals(t.relation())
                && GROUP.equals(t.subject().object().type())
                && groupId.equals(t.subject().object().id()));
        boolean granted = bindingTuples.stream().anyMatch(t ->
            GRANTED.equals(t.relation())
                && ROLE.equals(t.subject().object().type())
                && isRoleOrSubRole(t.subject().object().id(), roleId));
        return subject && granted;
    }

    private static boolean isRoleOrSubRole(String candidate, String roleId) {
        return candidate.equals(roleId) || candidate.startsWith(roleId + "_");
    }

    private static Set<ObjectReference> bindingNodes(RelationshipSet tuples) {
        Set<ObjectReference> nodes = new LinkedHashSet<>();
        for (Relationship tuple : tuples) {
            if (ROLE_BINDING.equals(tuple.object().type())) {
                nodes.add(tuple.object());
            }
            if (ROLE_BINDING.equals(tuple.subject().object().type())) {
                nodes.add(tuple.subject().object());
            }
        }
        return nodes;
    }
}
