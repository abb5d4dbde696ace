package com.reasoning.kgml.error;

/**
 * Evaluation failed at runtime: a callable raised, timed out, or an
 * evaluation chain looped back on itself.
 */
public final class KgmlExecutionException extends KgmlException {

    public KgmlExecutionException(String message) {
        super(message);
    }

    public KgmlExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.EXECUTION;
    }
}
