package com.reasoning.kgml.node;

/**
 * Closed set of node behaviours. The declared type label of a node may be
 * anything; its kind decides how it evaluates.
 */
public enum NodeKind {
    DATA,
    FUNCTION,
    OUTCOME,
    ACTION_META,
    EVENT_META;

    public boolean isMeta() {
        return this == ACTION_META || this == EVENT_META;
    }
}
