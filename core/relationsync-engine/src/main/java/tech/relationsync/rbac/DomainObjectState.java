package tech.relationsync.rbac;

import tech.relationsync.model.DomainObjectRef;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot of one RBAC domain object as read from the RBAC store.
 * The translator is a pure function of these values.
 */
public sealed interface DomainObjectState {

    DomainObjectRef ref();

    /**
     * A group with its direct principals and directly nested groups.
     */
    record GroupState(String id, String tenantId, Set<String> principals, Set<String> subgroupIds)
            implements DomainObjectState {

        public GroupState {
            Objects.requireNonNull(id, "id");
            principals = principals == null ? Set.of() : Set.copyOf(principals);
            subgroupIds = subgroupIds == null ? Set.of() : Set.copyOf(subgroupIds);
        }

        @Override
        public DomainObjectRef ref() {
            return DomainObjectRef.group(id);
        }
    }

    /**
     * A role and the permissions it grants. System roles are shared across tenants.
     */
    record RoleState(String id, String tenantId, boolean system, List<RoleAccess> access)
            implements DomainObjectState {

        public RoleState {
            Objects.requireNonNull(id, "id");
            access = access == null ? List.of() : List.copyOf(access);
        }

        @Override
        public DomainObjectRef ref() {
            return DomainObjectRef.role(id);
        }
    }

    /**
     * One role assigned to one group. {@code role} is empty when the role could not be resolved.
     */
    record RoleBindingState(
        String groupId,
        String roleId,
        Optional<RoleState> role,
        String tenantName,
        Optional<String> defaultWorkspaceId
    ) implements DomainObjectState {

        public RoleBindingState {
            Objects.requireNonNull(groupId, "groupId");
            Objects.requireNonNull(roleId, "roleId");
            role = role == null ? Optional.empty() : role;
            defaultWorkspaceId = defaultWorkspaceId == null ? Optional.empty() : defaultWorkspaceId;
        }

        @Override
        public DomainObjectRef ref() {
            return DomainObjectRef.roleBinding(groupId, roleId);
        }
    }

    /**
     * A workspace; a null parent means a root workspace attached to its tenant.
     */
    record WorkspaceState(String id, String tenantId, String parentId) implements DomainObjectState {

        public WorkspaceState {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(tenantId, "tenantId");
        }

        @Override
        public DomainObjectRef ref() {
            return DomainObjectRef.workspace(id);
        }
    }

    /**
     * A cross-account access request. Only approved requests grant anything.
     * {@code roles} holds the roles that could be resolved out of {@code roleIds}.
     */
    record CrossAccountRequestState(
        String requestId,
        String userId,
        String targetOrg,
        CrossAccountStatus status,
        List<String> roleIds,
        List<RoleState> roles,
        Optional<String> defaultWorkspaceId
    ) implements DomainObjectState {

        public CrossAccountRequestState {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(status, "status");
            roleIds = roleIds == null ? List.of() : List.copyOf(roleIds);
            roles = roles == null ? List.of() : List.copyOf(roles);
            defaultWorkspaceId = defaultWorkspaceId == null ? Optional.empty() : defaultWorkspaceId;
        }

        @Override
        public DomainObjectRef ref() {
            return DomainObjectRef.crossAccountRequest(requestId);
        }

        /**
         * Username of the cross-account principal, {@code <targetOrg>-<userId>}.
         */
        public String principalName() {
            return targetOrg + "-" + userId;
        }
    }
}
