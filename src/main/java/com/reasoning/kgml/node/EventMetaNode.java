package com.reasoning.kgml.node;

import java.util.Map;

/** Records an external event observed by the reasoning process. */
public final class EventMetaNode extends MetaNode {
    public static final String TYPE = "EventMetaNode";

    public EventMetaNode(String uid, Map<String, Object> metadata) {
        super(uid, TYPE, metadata);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EVENT_META;
    }

    @Override
    public EventMetaNode copy() {
        return new EventMetaNode(uid(), metadata());
    }
}
