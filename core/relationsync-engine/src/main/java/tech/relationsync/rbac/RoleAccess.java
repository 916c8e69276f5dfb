package tech.relationsync.rbac;

import java.util.List;
import java.util.Objects;

/**
 * A v1 permission ({@code app:resource:verb}) granted by a role, optionally narrowed by
 * resource definitions.
 */
public record RoleAccess(String permission, List<ResourceDefinition> resourceDefinitions) {

    public RoleAccess {
        Objects.requireNonNull(permission, "permission");
        resourceDefinitions = resourceDefinitions == null ? List.of() : List.copyOf(resourceDefinitions);
    }

    public static RoleAccess unscoped(String permission) {
        return new RoleAccess(permission, List.of());
    }

    public boolean isScoped() {
        return !resourceDefinitions.isEmpty();
    }
}
