package tech.relationsync.rbac;

import java.util.Locale;

/**
 * Lifecycle of a cross-account access request.
 */
public enum CrossAccountStatus {
    PENDING,
    APPROVED,
    DENIED,
    CANCELLED,
    EXPIRED;

    public static CrossAccountStatus fromValue(String value) {
        if (value == null) {
            return PENDING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
