package com.reasoning.kgml.dsl;

import com.reasoning.kgml.error.KgmlException;

/**
 * Outcome of {@link Kgml#validate(String)}.
 *
 * @param valid true if the text tokenizes and parses
 * @param error the lexical or syntax error otherwise
 */
public record ValidationResult(boolean valid, KgmlException error) {

    public static ValidationResult ok() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult failed(KgmlException error) {
        return new ValidationResult(false, error);
    }

    /** The error message, or null when valid. */
    public String message() {
        return error == null ? null : error.getMessage();
    }
}
