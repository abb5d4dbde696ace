package com.reasoning.kgml.node;

import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.util.Values;

/**
 * A function node that scores its own result.
 *
 * <p>
 * After each successful call the result becomes the last evaluation state
 * and the weight is set to {@code 1.0} if it matches the target state,
 * {@code -1.0} otherwise. Numbers match by value, so {@code 42L} matches
 * {@code 42}. The weight always stays within {@code [-1.0, 1.0]}.
 */
public class OutcomeNode extends FunctionNode {
    public static final String TYPE = "OutcomeNode";
    public static final String WEIGHT_KEY = "weight";
    public static final String TARGET_KEY = "target_eval_state";
    public static final String LAST_STATE_KEY = "last_eval_state";

    private double weight;
    private Object targetEvalState;
    private Object lastEvalState;

    public OutcomeNode(String uid) {
        this(uid, TYPE);
    }

    public OutcomeNode(String uid, String type) {
        super(uid, type);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OUTCOME;
    }

    public synchronized double weight() {
        return weight;
    }

    /**
     * @throws SemanticException if {@code weight} is outside {@code [-1.0, 1.0]}
     */
    public synchronized void setWeight(double weight) {
        checkMutable();
        this.weight = checkWeight(weight);
        touch();
    }

    public synchronized Object targetEvalState() {
        return targetEvalState;
    }

    public synchronized void setTargetEvalState(Object target) {
        checkMutable();
        this.targetEvalState = target;
        touch();
    }

    public synchronized Object lastEvalState() {
        return lastEvalState;
    }

    @Override
    protected synchronized void applyResult(Object result) {
        storeContent(result);
        lastEvalState = result;
        weight = Values.matches(result, targetEvalState) ? 1.0 : -1.0;
        touch();
    }

    @Override
    protected void validateProperty(String key, Object value) {
        if (WEIGHT_KEY.equals(key))
            checkWeight(Values.toDouble(key, value));
        else
            super.validateProperty(key, value);
    }

    @Override
    protected void applyProperty(String key, Object value) {
        switch (key) {
            case WEIGHT_KEY -> weight = Values.toDouble(key, value);
            case TARGET_KEY -> targetEvalState = value;
            case LAST_STATE_KEY -> lastEvalState = value;
            default -> super.applyProperty(key, value);
        }
    }

    private static double checkWeight(double weight) {
        if (Double.isNaN(weight) || weight < -1.0 || weight > 1.0)
            throw new SemanticException("Outcome weight must be within [-1.0, 1.0], got " + weight);
        return weight;
    }

    @Override
    public OutcomeNode copy() {
        OutcomeNode copy = new OutcomeNode(uid(), type());
        copyFunctionStateTo(copy);
        synchronized (this) {
            copy.weight = weight;
            copy.targetEvalState = targetEvalState;
            copy.lastEvalState = lastEvalState;
        }
        return copy;
    }
}
