package com.reasoning.kgml.graph;

import com.reasoning.kgml.error.SemanticException;

/**
 * The closed set of edge relations.
 *
 * <p>
 * Only {@link #EVAL_SEQUENCE} and {@link #PARAMETER} take part in evaluation
 * cascades; the others are descriptive.
 */
public enum LinkRelation {
    NON_FUNCTIONAL("non_functional"),
    /** Evaluate the target after the source, without arguments. */
    EVAL_SEQUENCE("eval_sequence"),
    /** Evaluate the target with the source's result as its only argument. */
    PARAMETER("parameter"),
    HIERARCHY("hierarchy"),
    CASUAL("casual");

    private final String label;

    LinkRelation(String label) {
        this.label = label;
    }

    /** The relation as written in KGML. */
    public String label() {
        return label;
    }

    public boolean cascades() {
        return this == EVAL_SEQUENCE || this == PARAMETER;
    }

    /**
     * @throws SemanticException for anything but one of the five labels
     */
    public static LinkRelation fromString(String label) {
        for (LinkRelation r : values()) {
            if (r.label.equals(label))
                return r;
        }
        throw new SemanticException("Invalid relation '" + label + "', expected one of "
                + "non_functional, eval_sequence, parameter, hierarchy, casual");
    }
}
