package com.reasoning.kgml.node;

import com.reasoning.kgml.api.Instructions;

import java.util.Map;

/**
 * Read-only audit record. Frozen at construction; every mutation fails with a
 * {@link com.reasoning.kgml.error.SemanticException}.
 */
public abstract class MetaNode extends GraphNode {

    protected MetaNode(String uid, String type, Map<String, Object> metadata) {
        super(uid, type, metadata, true);
    }

    /** Returns the metadata. Instructions that would write are rejected. */
    @Override
    public Object evaluate(Instructions instructions) {
        if (!instructions.isEmpty())
            checkMutable();
        return metadata();
    }

    @Override
    public void update(Instructions instructions) {
        checkMutable();
    }
}
