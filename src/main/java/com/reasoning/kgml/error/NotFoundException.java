package com.reasoning.kgml.error;

/**
 * A node or edge uid is not present in the graph.
 */
public final class NotFoundException extends KgmlException {
    private final String uid;

    public NotFoundException(String what, String uid) {
        super(what + " not found: " + uid);
        this.uid = uid;
    }

    public String uid() {
        return uid;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
