package com.reasoning.kgml.api;

/**
 * Capability every node kind exposes to the engine.
 *
 * <p>
 * The behaviour is fixed per node kind: data nodes return their content,
 * function nodes run their callable, outcome nodes additionally score the
 * result, and meta nodes are read-only records.
 */
public interface Evaluable {

    /** Unique id of the node within its graph. */
    String uid();

    /**
     * Evaluates the node.
     *
     * @param instructions arguments for the evaluation, {@link Instructions#none()} for none
     * @return the evaluation result
     */
    Object evaluate(Instructions instructions);

    /**
     * Applies instructions to the node's state.
     *
     * @throws com.reasoning.kgml.error.SemanticException if the node is read-only
     */
    void update(Instructions instructions);
}
