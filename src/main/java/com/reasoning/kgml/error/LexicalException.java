package com.reasoning.kgml.error;

/**
 * Raised by the tokenizer when the input cannot be split into tokens.
 */
public final class LexicalException extends KgmlException {
    private final SourcePosition position;

    public LexicalException(String message, SourcePosition position) {
        super(message + " at " + position);
        this.position = position;
    }

    public SourcePosition position() {
        return position;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.LEXICAL;
    }
}
