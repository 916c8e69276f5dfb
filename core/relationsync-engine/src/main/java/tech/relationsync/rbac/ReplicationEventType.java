package tech.relationsync.rbac;

import tech.relationsync.model.DomainObjectType;

/**
 * Kinds of RBAC mutation that trigger a sync. Used for logging and metrics;
 * the sync itself always recomputes the full canonical set.
 */
public enum ReplicationEventType {
    CREATE_GROUP(DomainObjectType.GROUP),
    UPDATE_GROUP(DomainObjectType.GROUP),
    DELETE_GROUP(DomainObjectType.GROUP),
    ADD_PRINCIPALS_TO_GROUP(DomainObjectType.GROUP),
    REMOVE_PRINCIPALS_FROM_GROUP(DomainObjectType.GROUP),
    CREATE_CUSTOM_ROLE(DomainObjectType.ROLE),
    UPDATE_CUSTOM_ROLE(DomainObjectType.ROLE),
    DELETE_CUSTOM_ROLE(DomainObjectType.ROLE),
    ASSIGN_ROLE(DomainObjectType.ROLE_BINDING),
    UNASSIGN_ROLE(DomainObjectType.ROLE_BINDING),
    CREATE_WORKSPACE(DomainObjectType.WORKSPACE),
    UPDATE_WORKSPACE(DomainObjectType.WORKSPACE),
    DELETE_WORKSPACE(DomainObjectType.WORKSPACE),
    APPROVE_CROSS_ACCOUNT_REQUEST(DomainObjectType.CROSS_ACCOUNT_REQUEST),
    DENY_CROSS_ACCOUNT_REQUEST(DomainObjectType.CROSS_ACCOUNT_REQUEST),
    EXPIRE_CROSS_ACCOUNT_REQUEST(DomainObjectType.CROSS_ACCOUNT_REQUEST),
    /** Not a mutation: a manual or scheduled repair. */
    RECONCILE(null);

    private final DomainObjectType objectType;

    ReplicationEventType(DomainObjectType objectType) {
        this.objectType = objectType;
    }

    /**
     * Whether this event is about objects of the given type. {@link #RECONCILE} applies to all.
     */
    public boolean appliesTo(DomainObjectType type) {
        return objectType == null || objectType == type;
    }
}
