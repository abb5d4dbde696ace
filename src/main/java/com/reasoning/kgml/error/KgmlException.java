package com.reasoning.kgml.error;

/**
 * Base type of all KGML failures.
 *
 * <p>
 * Unchecked, like the rest of the engine's fail-fast errors. Callers that need
 * to branch on the failure category use {@link #kind()} rather than
 * {@code instanceof} chains.
 */
public abstract class KgmlException extends RuntimeException {

    protected KgmlException(String message) {
        super(message);
    }

    protected KgmlException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
