package com.reasoning.kgml.graph;

import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.util.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A directed, typed edge between two nodes of the same graph.
 *
 * @param uid      unique id among the graph's edges
 * @param source   uid of the source node
 * @param target   uid of the target node
 * @param relation one of the five relations
 * @param metadata scalar properties in declaration order
 */
public record Link(String uid, String source, String target, LinkRelation relation, Map<String, Object> metadata) {
    public static final String RELATION_KEY = "relation";
    public static final String SOURCE_KEY = "source";
    public static final String TARGET_KEY = "target";

    public Link {
        if (uid == null || uid.isBlank())
            throw new SemanticException("Link uid must not be empty");
        if (source == null || target == null)
            throw new SemanticException("Link " + uid + " needs both a source and a target");
        Objects.requireNonNull(relation, "relation");
        Map<String, Object> copy = new LinkedHashMap<>();
        metadata.forEach((k, v) -> copy.put(k, Values.requireScalar(k, v)));
        metadata = Collections.unmodifiableMap(copy);
    }

    /**
     * A copy with {@code properties} merged in. {@code relation} changes the
     * relation; {@code source} and {@code target} must repeat the current
     * endpoints; every other key is metadata.
     *
     * @throws SemanticException for an unknown relation or a changed endpoint
     */
    public Link withProperties(Map<String, Object> properties) {
        LinkRelation rel = relation;
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        for (Map.Entry<String, Object> e : properties.entrySet()) {
            switch (e.getKey()) {
                case RELATION_KEY -> rel = LinkRelation.fromString(String.valueOf(e.getValue()));
                case SOURCE_KEY -> requireEndpoint(SOURCE_KEY, source, e.getValue());
                case TARGET_KEY -> requireEndpoint(TARGET_KEY, target, e.getValue());
                default -> meta.put(e.getKey(), e.getValue());
            }
        }
        return new Link(uid, source, target, rel, meta);
    }

    private void requireEndpoint(String key, String current, Object requested) {
        if (!current.equals(requested))
            throw new SemanticException("The " + key + " of link " + uid + " cannot change from " + current
                    + " to " + requested);
    }

    /** An edge without metadata whose uid is derived from its endpoints and relation. */
    public static Link of(String source, LinkRelation relation, String target) {
        return new Link(source + "_" + relation.label() + "_" + target, source, target, relation, Map.of());
    }
}
