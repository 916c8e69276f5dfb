package tech.relationsync.sync;

import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.rbac.ReplicationEventType;

/**
 * CDI event fired by RBAC write paths after a mutation commits.
 */
public record DomainObjectChanged(DomainObjectRef ref, ReplicationEventType eventType) {
}
