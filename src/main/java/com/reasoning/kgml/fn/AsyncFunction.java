package com.reasoning.kgml.fn;

import com.reasoning.kgml.api.ArgumentBundle;

import java.util.concurrent.CompletionStage;

/**
 * A non-blocking callable attached to a function node.
 *
 * <p>
 * The returned stage completes with the result. In blocking evaluation the
 * engine waits for it; in cooperative evaluation it is composed in place.
 */
@FunctionalInterface
public interface AsyncFunction {
    /**
     * Starts the computation.
     *
     * @param args positional and named arguments
     * @return a stage completing with the result
     */
    CompletionStage<?> apply(ArgumentBundle args);
}
