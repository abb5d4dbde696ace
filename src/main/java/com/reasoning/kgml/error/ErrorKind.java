package com.reasoning.kgml.error;

/**
 * Classification of every failure the KGML pipeline can report.
 */
public enum ErrorKind {
    /** Bad token: unterminated string, unknown marker glyph, malformed number. */
    LEXICAL,
    /** Unexpected token or grammar violation. */
    SYNTAX,
    /** Unknown relation, duplicate uid, frozen-node mutation, unresolved callable, out-of-range weight. */
    SEMANTIC,
    /** A callable raised, or a cycle was detected along an evaluation chain. */
    EXECUTION,
    /** A uid is missing on update, delete or evaluate. */
    NOT_FOUND
}
