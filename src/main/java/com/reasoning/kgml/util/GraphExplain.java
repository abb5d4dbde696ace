package com.reasoning.kgml.util;

import com.reasoning.kgml.graph.GraphStats;
import com.reasoning.kgml.graph.KnowledgeGraph;
import com.reasoning.kgml.graph.Link;
import com.reasoning.kgml.node.DataNode;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.node.OutcomeNode;

import java.util.List;

/**
 * Diagnostic utility for inspecting graph state and structure.
 *
 * <p>
 * Generates human-readable text for a single node, the whole graph, and a
 * Mermaid diagram suitable for embedding in Markdown.
 *
 * <p>
 * Intended for debugging sessions and error reports. Every call copies the
 * graph contents, so do not use it on a hot path.
 */
public final class GraphExplain {
    private static final int MAX_VALUE_LENGTH = 40;

    private final KnowledgeGraph graph;

    public GraphExplain(KnowledgeGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     *
     * @throws com.reasoning.kgml.error.NotFoundException if the node does not exist
     */
    public String explainNode(String uid) {
        GraphNode node = graph.getNode(uid);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(uid).append('\n')
                .append("  Type: ").append(node.type()).append(" (").append(node.kind()).append(")\n")
                .append("  Frozen: ").append(node.isFrozen()).append('\n')
                .append("  Updated: ").append(node.updatedAt()).append('\n');
        if (node instanceof DataNode data)
            sb.append("  Content: ").append(data.content()).append('\n');
        if (node instanceof OutcomeNode outcome) {
            sb.append("  Weight: ").append(outcome.weight()).append('\n')
                    .append("  Target: ").append(outcome.targetEvalState()).append('\n')
                    .append("  Last: ").append(outcome.lastEvalState()).append('\n');
        }
        if (!node.metadata().isEmpty())
            sb.append("  Metadata: ").append(node.metadata()).append('\n');
        List<Link> out = graph.outgoing(uid);
        sb.append("  Outgoing (").append(out.size()).append("): ");
        for (int i = 0; i < out.size(); i++) {
            Link link = out.get(i);
            sb.append(link.target()).append(" [").append(link.relation().label()).append(']');
            if (i < out.size() - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /** One line of counts per node kind and relation. */
    public String explainStats() {
        GraphStats stats = graph.stats();
        return "Nodes: " + stats.nodeCount() + " " + stats.nodesByKind()
                + ", Edges: " + stats.edgeCount() + " " + stats.edgesByRelation();
    }

    /**
     * Dumps every node with its outgoing edges in declaration order.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ")
                .append(graph.edgeCount()).append(" edges):\n");
        int i = 0;
        for (GraphNode node : graph.queryNodes(n -> true)) {
            sb.append("  [").append(i++).append("] ").append(node.uid()).append(" : ").append(node.type());
            if (node.isFrozen())
                sb.append(" (FROZEN)");
            List<Link> out = graph.outgoing(node.uid());
            if (!out.isEmpty()) {
                sb.append(" → ");
                for (int j = 0; j < out.size(); j++) {
                    sb.append(out.get(j).target()).append('/').append(out.get(j).relation().label());
                    if (j < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Cascading relations are drawn as solid arrows, descriptive ones as
     * dotted arrows; every edge is labelled with its relation.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in insertion order
        for (GraphNode node : graph.queryNodes(n -> true)) {
            sb.append("  ").append(sanitize(node.uid()))
                    .append("[\"").append(escape(node.uid())).append("<br/><i>").append(escape(node.type()))
                    .append("</i>");
            if (node instanceof OutcomeNode outcome)
                sb.append("<br/>w=").append(outcome.weight());
            else if (node instanceof DataNode data && data.content() != null)
                sb.append("<br/>").append(escape(abbreviate(String.valueOf(data.content()))));
            sb.append(node.kind().isMeta() ? "\"]:::meta;\n" : "\"];\n");
        }

        // 2. Declare all edges afterwards
        for (Link link : graph.queryEdges(e -> true)) {
            String arrow = link.relation().cascades() ? " -- \"" : " -. \"";
            String head = link.relation().cascades() ? "\" --> " : "\" .-> ";
            sb.append("  ").append(sanitize(link.source())).append(arrow).append(link.relation().label())
                    .append(head).append(sanitize(link.target())).append(";\n");
        }
        sb.append("  classDef meta fill:#eee,stroke:#999;\n");
        return sb.toString();
    }

    private static String abbreviate(String s) {
        return s.length() <= MAX_VALUE_LENGTH ? s : s.substring(0, MAX_VALUE_LENGTH - 3) + "...";
    }

    private static String escape(String s) {
        return s.replace("\"", "#quot;");
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
