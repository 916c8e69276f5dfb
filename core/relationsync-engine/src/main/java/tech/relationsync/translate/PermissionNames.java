package tech.relationsync.translate;

import tech.relationsync.model.RelationSchema;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Maps v1 permission strings and resource-definition keys onto relationship-store names.
 */
public final class PermissionNames {

    private static final String WORKSPACE_KEY = "inventory.groups";

    private PermissionNames() {
    }

    /**
     * {@code cost-management:*:read} becomes {@code cost_management_all_read}.
     */
    public static String toRelation(String v1Permission) {
        String[] parts = v1Permission == null ? new String[0] : v1Permission.split(":", -1);
        if (parts.length != 3 || Arrays.stream(parts).anyMatch(String::isBlank)) {
            throw new TranslationException("Malformed permission '" + v1Permission + "', expected app:resource:verb");
        }
        return Arrays.stream(parts)
            .map(PermissionNames::normalize)
            .collect(Collectors.joining("_"));
    }

    /**
     * {@code cost-management.aws.account} becomes {@code cost_management/aws_account};
     * {@code inventory.groups} is the workspace type.
     */
    public static String toScopeType(String resourceKey) {
        if (WORKSPACE_KEY.equals(resourceKey)) {
            return RelationSchema.WORKSPACE;
        }
        String[] parts = resourceKey == null ? new String[0] : resourceKey.split("\\.");
        if (parts.length < 2 || Arrays.stream(parts).anyMatch(String::isBlank)) {
            throw new TranslationException("Malformed resource definition key '" + resourceKey + "'");
        }
        String application = normalize(parts[0]);
        String resource = Arrays.stream(parts, 1, parts.length)
            .map(PermissionNames::normalize)
            .collect(Collectors.joining("_"));
        return application + "/" + resource;
    }

    private static String normalize(String part) {
        String trimmed = part.trim();
        return "*".equals(trimmed) ? "all" : trimmed.replace('-', '_');
    }
}
