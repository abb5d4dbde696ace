package com.reasoning.kgml.dsl;

/**
 * Kinds of KGML tokens.
 */
public enum TokenType {
    GRAPH_OPEN("KG►"),
    GRAPH_CLOSE("◄"),
    NODE_DECL("KGNODE►"),
    LINK_DECL("KGLINK►"),
    CREATE("C►"),
    UPDATE("U►"),
    DELETE("D►"),
    EVALUATE("E►"),
    NODE("N►"),
    IF("IF►"),
    ELIF("ELIF►"),
    ELSE("ELSE►"),
    LOOP("LOOP►"),
    IDENT("identifier"),
    STRING("string"),
    NUMBER("number"),
    COLON("':'"),
    COMMA("','"),
    EQUALS("'='"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    EOF("end of input");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    /** How the kind is named in error messages. */
    public String description() {
        return description;
    }

    /** True for the seven command markers. */
    public boolean isCommand() {
        return switch (this) {
            case NODE_DECL, LINK_DECL, CREATE, UPDATE, DELETE, EVALUATE, NODE -> true;
            default -> false;
        };
    }

    /** True for the four control markers. */
    public boolean isControl() {
        return switch (this) {
            case IF, ELIF, ELSE, LOOP -> true;
            default -> false;
        };
    }
}
