package com.reasoning.kgml.graph;

import java.time.Instant;

/**
 * Describes one snapshot kept by a {@link KnowledgeGraph}.
 */
public record GraphVersion(int version, String message, Instant createdAt, int nodeCount, int edgeCount) {
}
