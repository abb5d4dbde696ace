package com.reasoning.kgml.engine;

import com.reasoning.kgml.dsl.Verb;

/**
 * Result of one applied command.
 *
 * @param index  position of the command in its program
 * @param verb   the command's verb
 * @param uid    the node or edge the command targeted
 * @param status what happened
 * @param value  the evaluation result for {@link CommandStatus#EVALUATED}, null otherwise
 */
public record CommandResult(int index, Verb verb, String uid, CommandStatus status, Object value) {
}
