package com.reasoning.kgml.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a successfully executed program produced.
 *
 * <p>
 * {@code evaluations} maps every node evaluated by the program, cascades
 * included, to its latest result, in first-evaluation order. {@code commands}
 * holds one result per executed command, including the conditions and bodies
 * of control blocks, so it can be longer than the program.
 */
public record ExecutionResult(long programId, List<CommandResult> commands, Map<String, Object> evaluations) {
    public static final String VARIABLE_PREFIX = "eval_";

    public ExecutionResult {
        commands = List.copyOf(commands);
        evaluations = Collections.unmodifiableMap(new LinkedHashMap<>(evaluations));
    }

    public int size() {
        return commands.size();
    }

    public CommandResult get(int index) {
        return commands.get(index);
    }

    /** Latest evaluation result of {@code uid}, or null if it was not evaluated. */
    public Object evaluation(String uid) {
        return evaluations.get(uid);
    }

    public boolean evaluated(String uid) {
        return evaluations.containsKey(uid);
    }

    /** The evaluations as named variables, {@code eval_<uid>}, in the same order. */
    public Map<String, Object> variables() {
        Map<String, Object> vars = new LinkedHashMap<>();
        evaluations.forEach((uid, value) -> vars.put(VARIABLE_PREFIX + uid, value));
        return Collections.unmodifiableMap(vars);
    }

    /** Value of a variable named {@code eval_<uid>}, or null. */
    public Object variable(String name) {
        if (!name.startsWith(VARIABLE_PREFIX))
            return null;
        return evaluations.get(name.substring(VARIABLE_PREFIX.length()));
    }
}
