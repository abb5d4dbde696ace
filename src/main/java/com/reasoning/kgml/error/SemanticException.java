package com.reasoning.kgml.error;

/**
 * A well-formed request that violates a graph invariant.
 */
public final class SemanticException extends KgmlException {

    public SemanticException(String message) {
        super(message);
    }

    public SemanticException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SEMANTIC;
    }
}
