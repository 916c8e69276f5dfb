package tech.relationsync.model;

import java.util.Objects;

/**
 * Identifies one RBAC domain object. Every tuple in the store is owned by exactly one of these.
 */
public record DomainObjectRef(DomainObjectType type, String id) {

    private static final String BINDING_SEPARATOR = "/";

    public DomainObjectRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Domain object id must not be blank");
        }
    }

    public static DomainObjectRef group(String groupId) {
        return new DomainObjectRef(DomainObjectType.GROUP, groupId);
    }

    public static DomainObjectRef role(String roleId) {
        return new DomainObjectRef(DomainObjectType.ROLE, roleId);
    }

    public static DomainObjectRef roleBinding(String groupId, String roleId) {
        return new DomainObjectRef(DomainObjectType.ROLE_BINDING, groupId + BINDING_SEPARATOR + roleId);
    }

    public static DomainObjectRef workspace(String workspaceId) {
        return new DomainObjectRef(DomainObjectType.WORKSPACE, workspaceId);
    }

    public static DomainObjectRef crossAccountRequest(String requestId) {
        return new DomainObjectRef(DomainObjectType.CROSS_ACCOUNT_REQUEST, requestId);
    }

    /**
     * Group half of a role binding id.
     */
    public String bindingGroupId() {
        return bindingPart(0);
    }

    /**
     * Role half of a role binding id.
     */
    public String bindingRoleId() {
        return bindingPart(1);
    }

    private String bindingPart(int index) {
        if (type != DomainObjectType.ROLE_BINDING) {
            throw new IllegalStateException("Not a role binding: " + this);
        }
        String[] parts = id.split(BINDING_SEPARATOR, 2);
        if (parts.length != 2) {
            throw new IllegalStateException("Malformed role binding id: " + id);
        }
        return parts[index];
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
