package com.reasoning.kgml.fn;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named native callables that KGML function nodes may reference through their
 * {@code callable} property.
 */
public final class FunctionRegistry {
    private final Map<String, KgCallable> functions = new ConcurrentHashMap<>();

    public FunctionRegistry register(String name, SyncFunction fn) {
        functions.put(name, KgCallable.of(name, fn));
        return this;
    }

    public FunctionRegistry registerAsync(String name, AsyncFunction fn) {
        functions.put(name, KgCallable.ofAsync(name, fn));
        return this;
    }

    public Optional<KgCallable> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(functions.keySet());
    }
}
