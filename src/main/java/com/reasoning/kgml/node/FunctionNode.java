package com.reasoning.kgml.node;

import com.reasoning.kgml.api.ArgumentBundle;
import com.reasoning.kgml.api.Instructions;
import com.reasoning.kgml.api.RawText;
import com.reasoning.kgml.error.KgmlException;
import com.reasoning.kgml.error.KgmlExecutionException;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.fn.CallableResolver;
import com.reasoning.kgml.fn.KgCallable;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import lombok.extern.log4j.Log4j2;

/**
 * A data node whose evaluation runs a callable and stores the result as its
 * content.
 *
 * <p>
 * The callable is resolved lazily, in this order:
 * <ol>
 * <li>a callable attached with {@link #attach(KgCallable)}</li>
 * <li>the chain of a {@link CallableResolver}: the registry name in the
 * {@code callable} property, then the source in the {@code code} property</li>
 * </ol>
 * The resolution is cached until {@code callable} or {@code code} changes.
 *
 * <p>
 * Two execution paths exist. {@link #evaluate(Instructions)} blocks, waiting
 * for asynchronous callables up to the call timeout.
 * {@link #evaluateAsync(Instructions, Executor)} never blocks: synchronous
 * callables run on the given worker pool, asynchronous ones are composed in
 * place. Either way the result is written after the call completes, in one
 * step; a failed or cancelled call writes nothing.
 */
@Log4j2
public class FunctionNode extends DataNode {
    public static final String TYPE = "FunctionNode";
    public static final String CALLABLE_KEY = "callable";
    public static final String CODE_KEY = "code";

    private KgCallable attached;
    private KgCallable resolved;
    private CallableResolver resolver;
    private Duration callTimeout = Duration.ofSeconds(30);

    public FunctionNode(String uid) {
        this(uid, TYPE);
    }

    public FunctionNode(String uid, String type) {
        super(uid, type);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION;
    }

    /** Wires the resolver chain and the blocking-call timeout. */
    public synchronized FunctionNode bind(CallableResolver resolver, Duration callTimeout) {
        this.resolver = resolver;
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        this.resolved = null;
        return this;
    }

    /** Attaches a callable directly; it takes precedence over the properties. */
    public synchronized FunctionNode attach(KgCallable callable) {
        checkMutable();
        this.attached = callable;
        return this;
    }

    /**
     * Resolves the callable of this node.
     *
     * @throws SemanticException if no provider can supply one
     */
    public synchronized KgCallable callable() {
        if (attached != null)
            return attached;
        if (resolved == null) {
            if (resolver == null)
                throw new SemanticException("Unresolved callable for node " + uid() + ": no resolver bound");
            resolved = resolver.resolve(this);
        }
        return resolved;
    }

    @Override
    public Object evaluate(Instructions instructions) {
        checkMutable();
        KgCallable fn = callable();
        ArgumentBundle args = toArguments(instructions);
        Object result;
        CompletableFuture<?> pending = null;
        try {
            if (fn.isAsync()) {
                pending = fn.invokeAsync(args).toCompletableFuture();
                result = pending.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                result = fn.invoke(args);
            }
        } catch (InterruptedException e) {
            if (pending != null)
                pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new KgmlExecutionException("Interrupted while evaluating " + uid(), e);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new KgmlExecutionException("Callable " + fn.name() + " of node " + uid() + " timed out after "
                    + callTimeout.toMillis() + " ms", e);
        } catch (Exception e) {
            throw callFailed(fn, e);
        }
        applyResult(result);
        return result;
    }

    /**
     * Evaluates without blocking the caller.
     *
     * @param instructions arguments of the call
     * @param workers      pool that runs synchronous callables
     * @return a future completing with the result once it has been written;
     *         cancelling it before the call completes prevents the write
     */
    public CompletableFuture<Object> evaluateAsync(Instructions instructions, Executor workers) {
        KgCallable fn;
        ArgumentBundle args;
        try {
            checkMutable();
            fn = callable();
            args = toArguments(instructions);
        } catch (KgmlException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Object> call;
        if (fn.isAsync()) {
            try {
                call = fn.invokeAsync(args).toCompletableFuture().thenApply(r -> (Object) r);
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
        } else {
            call = CompletableFuture.supplyAsync(() -> {
                try {
                    return fn.invoke(args);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, workers);
        }

        return call.handle((result, error) -> {
            if (error != null)
                throw new CompletionException(callFailed(fn, error));
            return result;
        }).thenApply(result -> {
            applyResult(result);
            return result;
        });
    }

    /** Writes a call result. Subclasses extend the write; it stays one atomic step. */
    protected synchronized void applyResult(Object result) {
        storeContent(result);
        touch();
    }

    protected ArgumentBundle toArguments(Instructions instructions) {
        return instructions.fold(bundle -> bundle, RawText::toArguments);
    }

    @Override
    protected void applyProperty(String key, Object value) {
        super.applyProperty(key, value);
        if (CALLABLE_KEY.equals(key) || CODE_KEY.equals(key))
            resolved = null;
    }

    private KgmlExecutionException callFailed(KgCallable fn, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null)
            cause = cause.getCause();
        if (cause instanceof KgmlExecutionException kee)
            return kee;
        log.debug("Callable {} of node {} failed", fn.name(), uid(), cause);
        return new KgmlExecutionException("Callable " + fn.name() + " of node " + uid() + " failed: " + cause, cause);
    }

    @Override
    public FunctionNode copy() {
        FunctionNode copy = new FunctionNode(uid(), type());
        copyFunctionStateTo(copy);
        return copy;
    }

    protected final void copyFunctionStateTo(FunctionNode target) {
        copyStateTo(target);
        synchronized (this) {
            target.attached = attached;
            target.resolver = resolver;
            target.callTimeout = callTimeout;
        }
    }
}
