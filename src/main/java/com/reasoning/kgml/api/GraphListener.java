package com.reasoning.kgml.api;

import com.reasoning.kgml.graph.Link;
import com.reasoning.kgml.node.GraphNode;

/**
 * Receives mutation events from a {@link com.reasoning.kgml.graph.KnowledgeGraph}.
 *
 * <p>
 * Callbacks run inside the graph's write lock. Keep them short; a throwing
 * listener is logged and does not undo the mutation.
 */
public interface GraphListener {

    default void nodeAdded(GraphNode node) {
    }

    default void nodeUpdated(GraphNode node) {
    }

    default void nodeRemoved(GraphNode node) {
    }

    default void edgeAdded(Link link) {
    }

    default void edgeRemoved(Link link) {
    }

    default void edgeUpdated(Link link) {
    }
}
