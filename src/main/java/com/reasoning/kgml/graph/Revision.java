package com.reasoning.kgml.graph;

import java.time.Instant;

/**
 * One recorded state of a node or edge. Revision numbers start at 1 per uid
 * and keep counting when old revisions are dropped.
 */
public record Revision(String uid, int revision, String message, Instant createdAt) {
}
