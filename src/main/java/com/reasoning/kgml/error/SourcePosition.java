package com.reasoning.kgml.error;

/**
 * Location of a token in KGML text.
 *
 * @param offset zero-based character offset
 * @param line   one-based line number
 * @param column one-based column number
 */
public record SourcePosition(int offset, int line, int column) {

    @Override
    public String toString() {
        return "offset " + offset + " (line " + line + ", column " + column + ")";
    }
}
