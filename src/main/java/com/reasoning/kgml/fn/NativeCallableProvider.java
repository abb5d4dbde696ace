package com.reasoning.kgml.fn;

import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.node.FunctionNode;

import java.util.Optional;

/**
 * Resolves the {@code callable} property of a function node against a
 * {@link FunctionRegistry}.
 */
public final class NativeCallableProvider implements CallableProvider {
    private final FunctionRegistry registry;

    public NativeCallableProvider(FunctionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Optional<KgCallable> resolve(FunctionNode node) {
        Object ref = node.metadata(FunctionNode.CALLABLE_KEY);
        if (ref == null)
            return Optional.empty();
        String name = ref.toString();
        return Optional.of(registry.find(name)
                .orElseThrow(() -> new SemanticException(
                        "Node " + node.uid() + " references unknown callable '" + name + "'")));
    }
}
