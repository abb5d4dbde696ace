package com.reasoning.kgml.dsl;

import java.util.Iterator;
import java.util.List;

/**
 * An ordered, immutable list of statements parsed from one KGML document.
 */
public record Program(List<Statement> statements) implements Iterable<Statement> {

    public Program {
        statements = List.copyOf(statements);
    }

    public int size() {
        return statements.size();
    }

    public Statement get(int index) {
        return statements.get(index);
    }

    /**
     * The statement at {@code index}, which must be a plain command.
     *
     * @throws IllegalArgumentException if it is a control block
     */
    public Command command(int index) {
        if (statements.get(index) instanceof Command c)
            return c;
        throw new IllegalArgumentException("Statement " + index + " is not a plain command");
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public Iterator<Statement> iterator() {
        return statements.iterator();
    }
}
