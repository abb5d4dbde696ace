package com.reasoning.kgml.fn;

import com.reasoning.kgml.api.ArgumentBundle;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * A resolved callable together with its capability flag.
 *
 * <p>
 * Exactly one of the two function shapes is present. {@link #isAsync()}
 * selects the execution path; the engine never inspects the function itself
 * to decide.
 */
public final class KgCallable {
    private final String name;
    private final SyncFunction sync;
    private final AsyncFunction async;

    private KgCallable(String name, SyncFunction sync, AsyncFunction async) {
        this.name = Objects.requireNonNull(name, "name");
        this.sync = sync;
        this.async = async;
    }

    public static KgCallable of(String name, SyncFunction fn) {
        return new KgCallable(name, Objects.requireNonNull(fn, "fn"), null);
    }

    public static KgCallable ofAsync(String name, AsyncFunction fn) {
        return new KgCallable(name, null, Objects.requireNonNull(fn, "fn"));
    }

    public String name() {
        return name;
    }

    public boolean isAsync() {
        return async != null;
    }

    /**
     * Invokes a synchronous callable.
     *
     * @throws IllegalStateException if this callable is asynchronous
     */
    public Object invoke(ArgumentBundle args) throws Exception {
        if (sync == null)
            throw new IllegalStateException("Callable '" + name + "' is asynchronous");
        return sync.apply(args);
    }

    /**
     * Starts an asynchronous callable.
     *
     * @throws IllegalStateException if this callable is synchronous
     */
    public CompletionStage<?> invokeAsync(ArgumentBundle args) {
        if (async == null)
            throw new IllegalStateException("Callable '" + name + "' is synchronous");
        return async.apply(args);
    }

    @Override
    public String toString() {
        return (isAsync() ? "async " : "") + name;
    }
}
