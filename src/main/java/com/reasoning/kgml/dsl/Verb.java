package com.reasoning.kgml.dsl;

/**
 * What a command does. Each verb has exactly one marker.
 */
public enum Verb {
    NODE_DECL("KGNODE►"),
    LINK_DECL("KGLINK►"),
    CREATE("C►"),
    UPDATE("U►"),
    DELETE("D►"),
    EVALUATE("E►"),
    NODE("N►");

    private final String marker;

    Verb(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }

    static Verb of(TokenType type) {
        return switch (type) {
            case NODE_DECL -> NODE_DECL;
            case LINK_DECL -> LINK_DECL;
            case CREATE -> CREATE;
            case UPDATE -> UPDATE;
            case DELETE -> DELETE;
            case EVALUATE -> EVALUATE;
            case NODE -> NODE;
            default -> throw new IllegalArgumentException("Not a command marker: " + type);
        };
    }
}
