package tech.relationsync.rbac.jdbc;

/**
 * The RBAC store could not be queried.
 */
public class RbacQueryException extends RuntimeException {

    public RbacQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
