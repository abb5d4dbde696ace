package com.reasoning.kgml.api;

import java.util.function.Function;

/**
 * What to do when a node is evaluated or updated.
 *
 * <p>
 * Exactly two shapes exist: a structured {@link ArgumentBundle} of positional
 * and named values, and unstructured {@link RawText}. Consumers branch with
 * {@link #fold(Function, Function)}, which forces both cases to be handled.
 */
public interface Instructions {

    /**
     * Dispatches to the handler matching this instruction shape.
     */
    <R> R fold(Function<ArgumentBundle, R> onBundle, Function<RawText, R> onText);

    /** True when the instructions carry nothing to apply. */
    boolean isEmpty();

    /** The empty argument bundle. */
    static Instructions none() {
        return ArgumentBundle.EMPTY;
    }
}
