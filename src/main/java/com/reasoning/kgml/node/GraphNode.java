package com.reasoning.kgml.node;

import com.reasoning.kgml.api.Evaluable;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.util.Values;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of every vertex in a knowledge graph.
 *
 * <p>
 * A node is identified by its {@code uid}, which never changes. It carries a
 * declared type label, an ordered map of scalar metadata and two timestamps.
 * Nodes never reference each other; relations live in the graph's edges.
 *
 * <p>
 * State is guarded by the node's monitor so that a write applied after an
 * asynchronous call is seen as a single step by readers.
 */
public abstract class GraphNode implements Evaluable {
    private final String uid;
    private final String type;
    private final boolean frozen;
    private final Instant createdAt;
    private Instant updatedAt;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    protected GraphNode(String uid, String type, Map<String, Object> initialMetadata, boolean frozen) {
        if (uid == null || uid.isBlank())
            throw new SemanticException("Node uid must not be empty");
        this.uid = uid;
        this.type = Objects.requireNonNull(type, "type");
        initialMetadata.forEach((k, v) -> metadata.put(k, Values.requireScalar(k, v)));
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
        this.frozen = frozen;
    }

    @Override
    public final String uid() {
        return uid;
    }

    /** The declared type label, e.g. {@code "SensorNode"}. */
    public final String type() {
        return type;
    }

    public abstract NodeKind kind();

    public final boolean isFrozen() {
        return frozen;
    }

    public final Instant createdAt() {
        return createdAt;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    /** Copy of the metadata in insertion order. */
    public synchronized Map<String, Object> metadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public synchronized Object metadata(String key) {
        return metadata.get(key);
    }

    public synchronized void putMetadata(String key, Object value) {
        checkMutable();
        metadata.put(key, Values.requireScalar(key, value));
        touch();
    }

    public synchronized void removeMetadata(String key) {
        checkMutable();
        if (metadata.containsKey(key)) {
            metadata.remove(key);
            touch();
        }
    }

    /**
     * @throws SemanticException if the node is read-only
     */
    protected final void checkMutable() {
        if (frozen)
            throw new SemanticException("Node " + uid + " (" + type + ") is frozen and cannot be modified");
    }

    /** Advances {@code updatedAt}; never moves it backwards. */
    protected synchronized void touch() {
        Instant now = Instant.now();
        if (now.isAfter(updatedAt))
            updatedAt = now;
    }

    /** Writes a metadata entry without touching. Callers hold the monitor and have validated the value. */
    protected final void storeMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /**
     * Deep enough copy for snapshots: uid, type, metadata and kind-specific
     * state. Callables are shared, not copied.
     */
    public abstract GraphNode copy();

    /** Copies timestamps and metadata from {@code source}. Used by {@link #copy()}. */
    protected final void copyBaseState(GraphNode source) {
        synchronized (source) {
            metadata.clear();
            metadata.putAll(source.metadata);
            updatedAt = source.updatedAt;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + uid + ":" + type + "]";
    }
}
