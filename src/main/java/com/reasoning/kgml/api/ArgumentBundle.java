package com.reasoning.kgml.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Structured instructions: positional values plus named values.
 *
 * <p>
 * Both collections are copied and unmodifiable. Values may be {@code null}.
 */
public record ArgumentBundle(List<Object> positional, Map<String, Object> named) implements Instructions {

    public static final ArgumentBundle EMPTY = new ArgumentBundle(List.of(), Map.of());

    public ArgumentBundle {
        positional = Collections.unmodifiableList(new ArrayList<>(positional));
        named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
    }

    public static ArgumentBundle of(Object... positional) {
        List<Object> values = new ArrayList<>(positional.length);
        Collections.addAll(values, positional);
        return new ArgumentBundle(values, Map.of());
    }

    public static ArgumentBundle named(Map<String, Object> named) {
        return new ArgumentBundle(List.of(), named);
    }

    /** Positional value at {@code index}. */
    public Object arg(int index) {
        return positional.get(index);
    }

    /** Named value, or {@code null} when absent. */
    public Object get(String name) {
        return named.get(name);
    }

    public int size() {
        return positional.size();
    }

    @Override
    public <R> R fold(Function<ArgumentBundle, R> onBundle, Function<RawText, R> onText) {
        return onBundle.apply(this);
    }

    @Override
    public boolean isEmpty() {
        return positional.isEmpty() && named.isEmpty();
    }
}
