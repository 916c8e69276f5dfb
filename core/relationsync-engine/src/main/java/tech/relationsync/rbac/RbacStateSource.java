package tech.relationsync.rbac;

import tech.relationsync.model.DomainObjectRef;

import java.util.List;
import java.util.Optional;

/**
 * Read-only query interface onto the RBAC store.
 */
public interface RbacStateSource {

    /**
     * Load the current state of a domain object.
     *
     * @return empty when the object no longer exists
     */
    Optional<DomainObjectState> load(DomainObjectRef ref);

    /**
     * Every live domain object, for reconciliation sweeps.
     */
    List<DomainObjectRef> listDomainObjects();

    /**
     * Objects whose canonical tuple set depends on {@code ref}: bindings of a role or group,
     * cross-account requests naming a role, and groups nesting a group.
     */
    List<DomainObjectRef> findDependents(DomainObjectRef ref);
}
