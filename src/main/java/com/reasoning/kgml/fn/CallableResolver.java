package com.reasoning.kgml.fn;

import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.node.FunctionNode;

import java.util.List;
import java.util.Optional;

/**
 * Asks each provider in turn for a node's callable; the first answer wins.
 */
public final class CallableResolver {
    private final List<CallableProvider> providers;

    public CallableResolver(List<CallableProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    /**
     * @throws SemanticException if no provider applies to the node
     */
    public KgCallable resolve(FunctionNode node) {
        for (CallableProvider provider : providers) {
            Optional<KgCallable> callable = provider.resolve(node);
            if (callable.isPresent())
                return callable.get();
        }
        throw new SemanticException("Unresolved callable for node " + node.uid()
                + ": set '" + FunctionNode.CALLABLE_KEY + "' or '" + FunctionNode.CODE_KEY + "'");
    }
}
