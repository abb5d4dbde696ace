package com.reasoning.kgml.fn;

import com.reasoning.kgml.node.FunctionNode;

import java.util.Optional;

/**
 * One strategy for turning a function node's metadata into a callable.
 */
public interface CallableProvider {

    /**
     * @return the callable, or empty if this provider does not apply to the node
     * @throws com.reasoning.kgml.error.SemanticException if the provider applies
     *                                                    but the definition is invalid
     */
    Optional<KgCallable> resolve(FunctionNode node);
}
