package com.reasoning.kgml.api;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Unstructured instructions.
 *
 * <p>
 * There is no natural-language interpretation yet: callables receive the text
 * split on whitespace, one positional argument per token.
 */
public record RawText(String text) implements Instructions {

    public RawText {
        if (text == null)
            throw new IllegalArgumentException("text must not be null");
    }

    /** Naive whitespace split into positional arguments. */
    public ArgumentBundle toArguments() {
        String trimmed = text.strip();
        if (trimmed.isEmpty())
            return ArgumentBundle.EMPTY;
        List<Object> tokens = Arrays.asList((Object[]) trimmed.split("\\s+"));
        return new ArgumentBundle(tokens, Map.of());
    }

    @Override
    public <R> R fold(Function<ArgumentBundle, R> onBundle, Function<RawText, R> onText) {
        return onText.apply(this);
    }

    @Override
    public boolean isEmpty() {
        return text.isBlank();
    }
}
