package com.reasoning.kgml.error;

/**
 * Raised by the parser on the first token that does not fit the grammar.
 */
public final class KgmlSyntaxException extends KgmlException {
    private final String expected;
    private final String actual;
    private final SourcePosition position;

    public KgmlSyntaxException(String expected, String actual, SourcePosition position) {
        super("Expected " + expected + " but found " + actual + " at " + position);
        this.expected = expected;
        this.actual = actual;
        this.position = position;
    }

    /** Human readable description of the acceptable token kind(s). */
    public String expected() {
        return expected;
    }

    /** Description of the token that was found instead. */
    public String actual() {
        return actual;
    }

    public SourcePosition position() {
        return position;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SYNTAX;
    }
}
