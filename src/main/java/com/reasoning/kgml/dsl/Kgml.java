package com.reasoning.kgml.dsl;

import com.reasoning.kgml.error.KgmlException;

import java.util.List;

/**
 * Entry points for reading KGML text.
 */
public final class Kgml {
    private Kgml() {
        // Utility class
    }

    public static List<Token> tokenize(String text) {
        return Tokenizer.tokenize(text);
    }

    /**
     * Tokenizes and parses a document.
     *
     * @throws com.reasoning.kgml.error.LexicalException    on bad tokens
     * @throws com.reasoning.kgml.error.KgmlSyntaxException on grammar violations
     */
    public static Program parse(String text) {
        return new Parser(Tokenizer.tokenize(text)).parse();
    }

    /** Checks that {@code text} parses, without executing anything. */
    public static ValidationResult validate(String text) {
        try {
            parse(text);
            return ValidationResult.ok();
        } catch (KgmlException e) {
            return ValidationResult.failed(e);
        }
    }
}
