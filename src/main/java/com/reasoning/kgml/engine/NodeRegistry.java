package com.reasoning.kgml.engine;

import com.reasoning.kgml.fn.CallableResolver;
import com.reasoning.kgml.node.ActionMetaNode;
import com.reasoning.kgml.node.DataNode;
import com.reasoning.kgml.node.EventMetaNode;
import com.reasoning.kgml.node.FunctionNode;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.node.OutcomeNode;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps KGML type labels to node factories.
 *
 * <p>
 * Labels without a factory produce a {@link DataNode} carrying the label, so
 * {@code type="SensorNode"} is a data node of type {@code SensorNode}. Every
 * function node created here is bound to the registry's callable resolver.
 */
public final class NodeRegistry {

    /**
     * Creates a node. Mutable kinds receive their properties afterwards through
     * {@code update}; frozen kinds must consume them here.
     */
    @FunctionalInterface
    public interface NodeFactory {
        GraphNode create(String uid, String type, Map<String, Object> properties);
    }

    private final Map<String, NodeFactory> factories = new ConcurrentHashMap<>();
    private final CallableResolver resolver;
    private final Duration callTimeout;

    public NodeRegistry(CallableResolver resolver, Duration callTimeout) {
        this.resolver = resolver;
        this.callTimeout = callTimeout;
        registerBuiltIns();
    }

    public void registerFactory(String type, NodeFactory factory) {
        factories.put(type, factory);
    }

    public boolean isRegistered(String type) {
        return factories.containsKey(type);
    }

    public Set<String> types() {
        return Set.copyOf(factories.keySet());
    }

    public GraphNode create(String uid, String type, Map<String, Object> properties) {
        NodeFactory factory = factories.getOrDefault(type, (u, t, p) -> new DataNode(u, t));
        GraphNode node = factory.create(uid, type, properties);
        if (node instanceof FunctionNode fn)
            fn.bind(resolver, callTimeout);
        return node;
    }

    /** Binds a node built outside the registry, e.g. through the programmatic API. */
    public <N extends GraphNode> N bind(N node) {
        if (node instanceof FunctionNode fn)
            fn.bind(resolver, callTimeout);
        return node;
    }

    // ── Built-in Factories ──────────────────────────────────────────

    private void registerBuiltIns() {
        registerFactory(DataNode.TYPE, (uid, type, props) -> new DataNode(uid));
        registerFactory(FunctionNode.TYPE, (uid, type, props) -> new FunctionNode(uid));
        registerFactory(OutcomeNode.TYPE, (uid, type, props) -> new OutcomeNode(uid));
        registerFactory(ActionMetaNode.TYPE, (uid, type, props) -> new ActionMetaNode(uid, withoutType(props)));
        registerFactory(EventMetaNode.TYPE, (uid, type, props) -> new EventMetaNode(uid, withoutType(props)));
    }

    private static Map<String, Object> withoutType(Map<String, Object> props) {
        Map<String, Object> copy = new LinkedHashMap<>(props);
        copy.remove(DataNode.TYPE_KEY);
        return copy;
    }
}
