package com.reasoning.kgml.dsl;

import com.reasoning.kgml.api.Instructions;
import com.reasoning.kgml.error.SourcePosition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed command.
 *
 * <p>
 * For {@link Verb#EVALUATE} the arguments are in {@code instructions} and
 * {@code properties} is empty; for every other verb {@code instructions} is
 * empty. The source position is informational and does not take part in
 * equality, so a program equals its re-parsed serialization.
 *
 * @param verb         what to do
 * @param target       uid of the node or edge
 * @param properties   key/value pairs in source order, later duplicates win
 * @param instructions evaluation arguments
 * @param position     where the command marker starts
 */
public record Command(Verb verb, String target, Map<String, Object> properties, Instructions instructions,
        SourcePosition position) implements Statement {

    public static final String TYPE_KEY = "type";
    public static final String RELATION_KEY = "relation";

    public Command {
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(target, "target");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        instructions = instructions == null ? Instructions.none() : instructions;
    }

    public Command(Verb verb, String target, Map<String, Object> properties) {
        this(verb, target, properties, Instructions.none(), null);
    }

    /** The {@code relation} property for links, the {@code type} property otherwise; null if absent. */
    public String tag() {
        Object tag = properties.get(verb == Verb.LINK_DECL ? RELATION_KEY : TYPE_KEY);
        return tag == null ? null : tag.toString();
    }

    public Object property(String key) {
        return properties.get(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Command other))
            return false;
        return verb == other.verb && target.equals(other.target) && properties.equals(other.properties)
                && instructions.equals(other.instructions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verb, target, properties, instructions);
    }

    @Override
    public String toString() {
        return verb.marker() + " " + target + (properties.isEmpty() ? "" : " " + properties)
                + (instructions.isEmpty() ? "" : " " + instructions);
    }
}
