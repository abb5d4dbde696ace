package com.reasoning.kgml.dsl;

import java.util.List;
import java.util.Objects;

/**
 * {@code IF► … ELIF► … ELSE► … ◄}. Branches are tried in order; the body of
 * the first branch whose condition evaluates truthy runs, otherwise the
 * {@code ELSE►} body.
 *
 * @param branches  the {@code IF►} branch followed by every {@code ELIF►}
 * @param otherwise the {@code ELSE►} body, empty when absent
 */
public record Conditional(List<Branch> branches, List<Statement> otherwise) implements Statement {

    public Conditional {
        if (branches.isEmpty())
            throw new IllegalArgumentException("A conditional needs at least one branch");
        branches = List.copyOf(branches);
        otherwise = List.copyOf(otherwise);
    }

    /**
     * @param condition an {@code E►} command whose result decides the branch
     * @param body      statements run when it is truthy
     */
    public record Branch(Command condition, List<Statement> body) {
        public Branch {
            Objects.requireNonNull(condition, "condition");
            if (condition.verb() != Verb.EVALUATE)
                throw new IllegalArgumentException("Branch condition must be an E► command: " + condition);
            body = List.copyOf(body);
        }
    }
}
