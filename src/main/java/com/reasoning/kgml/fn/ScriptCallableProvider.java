package com.reasoning.kgml.fn;

import com.reasoning.kgml.api.ArgumentBundle;
import com.reasoning.kgml.api.GraphListener;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.node.FunctionNode;
import com.reasoning.kgml.node.GraphNode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Compiles the JavaScript source in a node's {@code code} property and
 * exposes its {@code func} binding as a synchronous callable.
 *
 * <p>
 * Every snippet gets a fresh, isolated context: no host class lookup, no host
 * access, no I/O. Calls into one context are serialized because a polyglot
 * context must not be entered by two threads at once.
 *
 * <p>
 * Positional arguments are passed as JavaScript arguments; named arguments,
 * when present, follow as one trailing object. Results convert back to
 * {@code null}, {@link Boolean}, {@link Long} or {@link Double},
 * {@link String}, or a {@link List} for arrays.
 *
 * <p>
 * Node callables are cached per uid together with their source. Resolving a
 * node again with the same source reuses its context; a changed source
 * closes the old one. Registered as a {@link GraphListener}, the provider
 * closes a node's context when the node is deleted.
 */
public final class ScriptCallableProvider implements CallableProvider, GraphListener, AutoCloseable {
    private static final Logger log = LogManager.getLogger(ScriptCallableProvider.class);

    public static final String LANGUAGE = "js";
    public static final String ENTRY_POINT = "func";

    private final Map<String, Compiled> byNode = new ConcurrentHashMap<>();
    private final List<Context> detached = new CopyOnWriteArrayList<>();

    @Override
    public Optional<KgCallable> resolve(FunctionNode node) {
        Object code = node.metadata(FunctionNode.CODE_KEY);
        if (code == null) {
            release(node.uid());
            return Optional.empty();
        }
        String source = code.toString();
        synchronized (byNode) {
            Compiled current = byNode.get(node.uid());
            if (current != null && current.source.equals(source))
                return Optional.of(current.callable);
            Compiled fresh = build(node.uid(), source);
            if (current != null) {
                log.debug("Recompiled script callable for node {}", node.uid());
                current.close();
            }
            byNode.put(node.uid(), fresh);
            return Optional.of(fresh.callable);
        }
    }

    @Override
    public void nodeRemoved(GraphNode node) {
        release(node.uid());
    }

    /** Closes the context compiled for {@code uid}, if any. */
    public void release(String uid) {
        Compiled compiled;
        synchronized (byNode) {
            compiled = byNode.remove(uid);
        }
        if (compiled != null) {
            compiled.close();
            log.debug("Released script callable of node {}", uid);
        }
    }

    /** Number of contexts currently open. */
    public int openContexts() {
        return byNode.size() + detached.size();
    }

    /**
     * Evaluates {@code source} in a new context and extracts {@code func}.
     * The context stays open until {@link #close()}.
     *
     * @throws SemanticException if the source does not evaluate or defines no executable {@code func}
     */
    public KgCallable compile(String name, String source) {
        Compiled compiled = build(name, source);
        detached.add(compiled.context);
        return compiled.callable;
    }

    private Compiled build(String name, String source) {
        Context context = Context.newBuilder(LANGUAGE)
                .option("engine.WarnInterpreterOnly", "false")
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .allowAllAccess(false)
                .build();
        Value func;
        try {
            context.eval(LANGUAGE, source);
            func = context.getBindings(LANGUAGE).getMember(ENTRY_POINT);
        } catch (PolyglotException e) {
            context.close();
            throw new SemanticException("Code of node " + name + " does not compile: " + e.getMessage(), e);
        }
        if (func == null || !func.canExecute()) {
            context.close();
            throw new SemanticException("Code of node " + name + " does not define an executable '" + ENTRY_POINT + "'");
        }
        log.debug("Compiled script callable for node {}", name);
        return new Compiled(source, context, KgCallable.of(name, args -> call(context, func, args)));
    }

    private static Object call(Context context, Value func, ArgumentBundle args) {
        synchronized (context) {
            List<Object> params = new ArrayList<>(args.positional());
            if (!args.named().isEmpty())
                params.add(ProxyObject.fromMap(new HashMap<>(args.named())));
            return toJava(func.execute(params.toArray()));
        }
    }

    static Object toJava(Value value) {
        if (value == null || value.isNull())
            return null;
        if (value.isBoolean())
            return value.asBoolean();
        if (value.isNumber()) {
            if (value.fitsInLong())
                return value.asLong();
            return value.asDouble();
        }
        if (value.isString())
            return value.asString();
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>((int) value.getArraySize());
            for (long i = 0; i < value.getArraySize(); i++)
                list.add(toJava(value.getArrayElement(i)));
            return list;
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys())
                map.put(key, toJava(value.getMember(key)));
            return map;
        }
        return value.toString();
    }

    /** Closes every context this provider created. */
    @Override
    public void close() {
        synchronized (byNode) {
            byNode.values().forEach(Compiled::close);
            byNode.clear();
        }
        for (Context context : detached)
            closeContext(context);
        detached.clear();
    }

    private static void closeContext(Context context) {
        synchronized (context) {
            context.close();
        }
    }

    private record Compiled(String source, Context context, KgCallable callable) {
        void close() {
            closeContext(context);
        }
    }
}
