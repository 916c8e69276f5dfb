package tech.relationsync.translate;

import tech.relationsync.model.DomainObjectRef;

/**
 * The snapshot references something that could not be loaded, typically because a
 * concurrent RBAC transaction has not committed yet. Re-reading the state may succeed.
 */
public class IncompleteDomainStateException extends TranslationException {

    private final DomainObjectRef ref;

    public IncompleteDomainStateException(DomainObjectRef ref, String message) {
        super(message + " (" + ref + ")");
        this.ref = ref;
    }

    public DomainObjectRef getRef() {
        return ref;
    }
}
