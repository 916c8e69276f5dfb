package tech.relationsync.support;

import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.DomainObjectType;
import tech.relationsync.rbac.DomainObjectState;
import tech.relationsync.rbac.DomainObjectState.CrossAccountRequestState;
import tech.relationsync.rbac.DomainObjectState.GroupState;
import tech.relationsync.rbac.DomainObjectState.RoleBindingState;
import tech.relationsync.rbac.DomainObjectState.RoleState;
import tech.relationsync.rbac.DomainObjectState.WorkspaceState;
import tech.relationsync.rbac.RbacStateSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RBAC store fake. Role bindings are derived on load so they always see the current role.
 */
public class InMemoryRbacStateSource implements RbacStateSource {

    private final Map<DomainObjectRef, DomainObjectState> objects = new LinkedHashMap<>();
    private final Map<DomainObjectRef, String> bindingTenants = new LinkedHashMap<>();
    private String defaultWorkspaceId = "org_default";

    public synchronized InMemoryRbacStateSource put(DomainObjectState state) {
        objects.put(state.ref(), state);
        return this;
    }

    public synchronized InMemoryRbacStateSource bind(String groupId, String roleId) {
        return bind(groupId, roleId, "acme");
    }

    public synchronized InMemoryRbacStateSource bind(String groupId, String roleId, String tenantName) {
        DomainObjectRef ref = DomainObjectRef.roleBinding(groupId, roleId);
        bindingTenants.put(ref, tenantName);
        objects.put(ref, placeholder(groupId, roleId, tenantName));
        return this;
    }

    public synchronized void remove(DomainObjectRef ref) {
        objects.remove(ref);
        bindingTenants.remove(ref);
    }

    /**
     * Remove a group the way the RBAC store does: its bindings go with it.
     */
    public synchronized void deleteGroup(String groupId) {
        remove(DomainObjectRef.group(groupId));
        List<DomainObjectRef> bindings = objects.keySet().stream()
            .filter(r -> r.type() == DomainObjectType.ROLE_BINDING && r.bindingGroupId().equals(groupId))
            .toList();
        bindings.forEach(this::remove);
        for (DomainObjectState state : List.copyOf(objects.values())) {
            if (state instanceof GroupState group && group.subgroupIds().contains(groupId)) {
                List<String> remaining = group.subgroupIds().stream().filter(id -> !id.equals(groupId)).toList();
                objects.put(group.ref(), new GroupState(group.id(), group.tenantId(), group.principals(),
                    new LinkedHashSet<>(remaining)));
            }
        }
    }

    public synchronized void setDefaultWorkspaceId(String defaultWorkspaceId) {
        this.defaultWorkspaceId = defaultWorkspaceId;
    }

    @Override
    public synchronized Optional<DomainObjectState> load(DomainObjectRef ref) {
        DomainObjectState state = objects.get(ref);
        if (state instanceof RoleBindingState binding) {
            Optional<RoleState> role = Optional.ofNullable(objects.get(DomainObjectRef.role(binding.roleId())))
                .map(RoleState.class::cast);
            return Optional.of(new RoleBindingState(binding.groupId(), binding.roleId(), role,
                bindingTenants.get(ref), Optional.ofNullable(defaultWorkspaceId)));
        }
        if (state instanceof CrossAccountRequestState request) {
            List<RoleState> roles = new ArrayList<>();
            for (String roleId : request.roleIds()) {
                Optional.ofNullable(objects.get(DomainObjectRef.role(roleId)))
                    .map(RoleState.class::cast)
                    .ifPresent(roles::add);
            }
            return Optional.of(new CrossAccountRequestState(request.requestId(), request.userId(),
                request.targetOrg(), request.status(), request.roleIds(), roles, Optional.ofNullable(defaultWorkspaceId)));
        }
        return Optional.ofNullable(state);
    }

    @Override
    public synchronized List<DomainObjectRef> listDomainObjects() {
        return List.copyOf(objects.keySet());
    }

    @Override
    public synchronized List<DomainObjectRef> findDependents(DomainObjectRef ref) {
        List<DomainObjectRef> dependents = new ArrayList<>();
        for (DomainObjectState state : objects.values()) {
            if (state instanceof RoleBindingState binding) {
                if ((ref.type() == DomainObjectType.GROUP && binding.groupId().equals(ref.id()))
                    || (ref.type() == DomainObjectType.ROLE && binding.roleId().equals(ref.id()))) {
                    dependents.add(binding.ref());
                }
            } else if (state instanceof GroupState group) {
                if (ref.type() == DomainObjectType.GROUP && group.subgroupIds().contains(ref.id())) {
                    dependents.add(group.ref());
                }
            } else if (state instanceof CrossAccountRequestState request) {
                if (ref.type() == DomainObjectType.ROLE && request.roleIds().contains(ref.id())) {
                    dependents.add(request.ref());
                }
            } else if (state instanceof WorkspaceState workspace) {
                if (ref.type() == DomainObjectType.WORKSPACE && ref.id().equals(workspace.parentId())) {
                    dependents.add(workspace.ref());
                }
            }
        }
        return dependents;
    }

    private static RoleBindingState placeholder(String groupId, String roleId, String tenantName) {
        return new RoleBindingState(groupId, roleId, Optional.empty(), tenantName, Optional.empty());
    }
}
