package com.reasoning.kgml.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a knowledge graph in node-link form.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDocument {
    private boolean directed = true;
    private boolean multigraph = true;
    private List<NodeEntry> nodes;
    private List<LinkEntry> links;

    /** One node. Outcome fields are only present for outcome nodes. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeEntry {
        private String id, type, kind;
        private boolean frozen;
        private String createdAt, updatedAt;
        private Object content;
        private Map<String, Object> metadata;
        private Double weight;
        private Object targetEvalState, lastEvalState;
    }

    /** One edge. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class LinkEntry {
        private String id, source, target, relation;
        private Map<String, Object> metadata;
    }
}
