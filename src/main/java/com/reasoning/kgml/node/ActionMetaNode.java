package com.reasoning.kgml.node;

import java.util.Map;

/** Records a decision taken by the reasoning process. */
public final class ActionMetaNode extends MetaNode {
    public static final String TYPE = "ActionMetaNode";

    public ActionMetaNode(String uid, Map<String, Object> metadata) {
        super(uid, TYPE, metadata);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ACTION_META;
    }

    @Override
    public ActionMetaNode copy() {
        return new ActionMetaNode(uid(), metadata());
    }
}
