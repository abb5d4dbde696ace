package com.reasoning.kgml.dsl;

import java.util.List;
import java.util.Objects;

/**
 * {@code LOOP► E► … ◄}: evaluates the condition, runs the body while the
 * result is truthy, then evaluates the condition again. The executor bounds
 * the number of iterations.
 *
 * @param condition an {@code E►} command
 * @param body      statements run on every iteration
 */
public record Loop(Command condition, List<Statement> body) implements Statement {

    public Loop {
        Objects.requireNonNull(condition, "condition");
        if (condition.verb() != Verb.EVALUATE)
            throw new IllegalArgumentException("Loop condition must be an E► command: " + condition);
        body = List.copyOf(body);
    }
}
