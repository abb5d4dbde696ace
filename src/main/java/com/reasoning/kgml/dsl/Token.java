package com.reasoning.kgml.dsl;

import com.reasoning.kgml.error.SourcePosition;

/**
 * One lexical unit.
 *
 * @param type     kind of token
 * @param text     the literal text as it appears in the input
 * @param value    decoded value: the unescaped string, a {@link Long} or
 *                 {@link Double} for numbers, the name for identifiers,
 *                 {@code null} otherwise
 * @param position where the token starts
 */
public record Token(TokenType type, String text, Object value, SourcePosition position) {

    /** Description used by syntax errors, e.g. {@code identifier 'Sensor01'}. */
    public String describe() {
        return switch (type) {
            case IDENT, STRING, NUMBER -> type.description() + " '" + text + "'";
            default -> type.description();
        };
    }
}
