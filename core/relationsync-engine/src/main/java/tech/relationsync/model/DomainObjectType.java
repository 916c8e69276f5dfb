package tech.relationsync.model;

import java.util.Locale;

/**
 * Kinds of RBAC domain objects that own tuples in the relationship store.
 */
public enum DomainObjectType {
    GROUP,
    ROLE,
    /** A role assigned to a group, identified as {@code groupId/roleId}. */
    ROLE_BINDING,
    WORKSPACE,
    CROSS_ACCOUNT_REQUEST;

    public static DomainObjectType fromPath(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
