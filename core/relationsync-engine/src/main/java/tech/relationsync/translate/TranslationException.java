package tech.relationsync.translate;

/**
 * A domain object cannot be expressed as tuples. Not retryable: the RBAC data itself
 * has to change before translation can succeed.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
