package com.reasoning.kgml.node;

import com.reasoning.kgml.api.ArgumentBundle;
import com.reasoning.kgml.api.Instructions;
import com.reasoning.kgml.api.RawText;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.util.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;

/**
 * A node holding arbitrary content.
 *
 * <p>
 * Evaluating without instructions returns the content and changes nothing.
 * Updates accept either an argument bundle or raw text:
 * <ul>
 * <li>named {@code content} replaces the content</li>
 * <li>named {@code type} must equal the declared type</li>
 * <li>any other named value becomes metadata</li>
 * <li>one positional value replaces the content, several become a list</li>
 * <li>raw text becomes the content as is</li>
 * </ul>
 */
public class DataNode extends GraphNode {
    public static final String TYPE = "DataNode";
    public static final String CONTENT_KEY = "content";
    public static final String TYPE_KEY = "type";

    private Object content;

    public DataNode(String uid) {
        this(uid, TYPE);
    }

    public DataNode(String uid, String type) {
        super(uid, type, Map.of(), false);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DATA;
    }

    public synchronized Object content() {
        return content;
    }

    public synchronized void setContent(Object content) {
        checkMutable();
        this.content = content;
        touch();
    }

    @Override
    public Object evaluate(Instructions instructions) {
        if (!instructions.isEmpty())
            update(instructions);
        return content();
    }

    @Override
    public synchronized void update(Instructions instructions) {
        checkMutable();
        instructions.fold(bundle -> {
            applyBundle(bundle);
            return null;
        }, text -> {
            applyText(text);
            return null;
        });
        touch();
    }

    // Validates every entry before writing any, so a rejected bundle leaves the node unchanged.
    private void applyBundle(ArgumentBundle bundle) {
        bundle.named().forEach(this::validateProperty);
        for (Map.Entry<String, Object> e : bundle.named().entrySet()) {
            String key = e.getKey();
            if (CONTENT_KEY.equals(key))
                content = e.getValue();
            else if (!TYPE_KEY.equals(key))
                applyProperty(key, e.getValue());
        }
        if (bundle.size() == 1)
            content = bundle.arg(0);
        else if (bundle.size() > 1)
            content = Collections.unmodifiableList(new ArrayList<>(bundle.positional()));
    }

    protected void applyText(RawText text) {
        content = text.text();
    }

    /**
     * Rejects a property before anything is written. Subclasses add their own
     * reserved keys and must call {@code super}.
     */
    protected void validateProperty(String key, Object value) {
        if (TYPE_KEY.equals(key)) {
            if (!type().equals(String.valueOf(value)))
                throw new SemanticException("Cannot change type of node " + uid() + " from " + type() + " to " + value);
            return;
        }
        if (!CONTENT_KEY.equals(key))
            Values.requireScalar(key, value);
    }

    /** Stores a validated property. Called with the node's monitor held. */
    protected void applyProperty(String key, Object value) {
        storeMetadata(key, value);
    }

    /** Replaces the content without the frozen check. Called with the monitor held. */
    protected final void storeContent(Object value) {
        content = value;
    }

    @Override
    public DataNode copy() {
        DataNode copy = new DataNode(uid(), type());
        copyStateTo(copy);
        return copy;
    }

    protected final void copyStateTo(DataNode target) {
        synchronized (this) {
            target.copyBaseState(this);
            target.content = content;
        }
    }
}
