package tech.relationsync.rbac;

import java.util.Objects;

/**
 * An attribute filter narrowing a permission to specific resources,
 * e.g. {@code cost-management.aws.account equal 123456}.
 */
public record ResourceDefinition(String key, String operation, String value) {

    public static final String OPERATION_EQUAL = "equal";
    public static final String OPERATION_IN = "in";

    public ResourceDefinition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(value, "value");
    }

    public static ResourceDefinition equal(String key, String value) {
        return new ResourceDefinition(key, OPERATION_EQUAL, value);
    }

    public static ResourceDefinition in(String key, String... values) {
        return new ResourceDefinition(key, OPERATION_IN, String.join(",", values));
    }

    /**
     * Stable text form used when deriving synthetic ids.
     */
    public String canonical() {
        return key + "|" + operation + "|" + value;
    }
}
