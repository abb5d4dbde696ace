package com.reasoning.kgml.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.reasoning.kgml.graph.KnowledgeGraph;
import com.reasoning.kgml.graph.Link;
import com.reasoning.kgml.node.DataNode;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.node.OutcomeNode;
import com.reasoning.kgml.util.Values;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON export of a graph in node-link form, the format external viewers read.
 *
 * <p>
 * Content that is not a scalar, list or map is exported as its string form.
 */
public final class GraphJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private GraphJson() {
        // Utility class
    }

    public static GraphDocument toDocument(KnowledgeGraph graph) {
        List<GraphDocument.NodeEntry> nodes = new ArrayList<>();
        for (GraphNode node : graph.queryNodes(n -> true))
            nodes.add(nodeEntry(node));
        List<GraphDocument.LinkEntry> links = new ArrayList<>();
        for (Link link : graph.queryEdges(e -> true))
            links.add(linkEntry(link));
        GraphDocument doc = new GraphDocument();
        doc.setNodes(nodes);
        doc.setLinks(links);
        return doc;
    }

    public static String toJson(KnowledgeGraph graph) {
        try {
            return MAPPER.writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph", e);
        }
    }

    public static void write(KnowledgeGraph graph, Path path) {
        try {
            Files.writeString(path, toJson(graph));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write graph to " + path, e);
        }
    }

    public static GraphDocument parse(String json) {
        try {
            return MAPPER.readValue(json, GraphDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static GraphDocument.NodeEntry nodeEntry(GraphNode node) {
        GraphDocument.NodeEntry entry = new GraphDocument.NodeEntry();
        entry.setId(node.uid());
        entry.setType(node.type());
        entry.setKind(node.kind().name());
        entry.setFrozen(node.isFrozen());
        entry.setCreatedAt(node.createdAt().toString());
        entry.setUpdatedAt(node.updatedAt().toString());
        entry.setMetadata(node.metadata());
        if (node instanceof DataNode data)
            entry.setContent(exportable(data.content()));
        if (node instanceof OutcomeNode outcome) {
            entry.setWeight(outcome.weight());
            entry.setTargetEvalState(exportable(outcome.targetEvalState()));
            entry.setLastEvalState(exportable(outcome.lastEvalState()));
        }
        return entry;
    }

    private static GraphDocument.LinkEntry linkEntry(Link link) {
        GraphDocument.LinkEntry entry = new GraphDocument.LinkEntry();
        entry.setId(link.uid());
        entry.setSource(link.source());
        entry.setTarget(link.target());
        entry.setRelation(link.relation().label());
        entry.setMetadata(link.metadata());
        return entry;
    }

    private static Object exportable(Object value) {
        if (Values.isScalar(value))
            return value;
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object o : list)
                out.add(exportable(o));
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), exportable(v)));
            return out;
        }
        return value.toString();
    }
}
