package com.reasoning.kgml.dsl;

/**
 * One element of a program: a plain {@link Command}, or a control block
 * ({@link Conditional}, {@link Loop}) whose bodies hold further statements.
 */
public sealed interface Statement permits Command, Conditional, Loop {
}
