package com.reasoning.kgml.fn;

import com.reasoning.kgml.api.ArgumentBundle;

/**
 * A blocking callable attached to a function node.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code args -> 42}</li>
 * <li>{@code args -> ((Number) args.arg(0)).longValue() + ((Number) args.arg(1)).longValue()}</li>
 * </ul>
 */
@FunctionalInterface
public interface SyncFunction {
    /**
     * Applies the function.
     *
     * @param args positional and named arguments
     * @return the result, stored as the node's new content
     * @throws Exception any failure; the engine reports it as an execution error
     */
    Object apply(ArgumentBundle args) throws Exception;
}
