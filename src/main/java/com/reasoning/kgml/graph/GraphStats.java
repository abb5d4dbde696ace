package com.reasoning.kgml.graph;

import com.reasoning.kgml.node.NodeKind;

import java.util.Map;

/**
 * Counts of a graph at one point in time.
 */
public record GraphStats(int nodeCount, int edgeCount, Map<NodeKind, Integer> nodesByKind,
        Map<LinkRelation, Integer> edgesByRelation) {

    public GraphStats {
        nodesByKind = Map.copyOf(nodesByKind);
        edgesByRelation = Map.copyOf(edgesByRelation);
    }
}
