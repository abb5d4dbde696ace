package com.reasoning.kgml.error;

/**
 * Reports the command of a program that aborted execution.
 *
 * <p>
 * Commands before {@link #commandIndex()} have already been applied; the
 * engine does not roll them back. Use a graph snapshot taken before execution
 * to undo them. For a command inside an {@code IF►} or {@code LOOP►} block the
 * index is that of the enclosing top-level statement, while the verb and uid
 * are those of the failing command itself.
 */
public final class CommandFailedException extends KgmlException {
    private final int commandIndex;
    private final String verb;
    private final String uid;

    public CommandFailedException(int commandIndex, String verb, String uid, KgmlException cause) {
        super("Command #" + commandIndex + " (" + verb + " " + uid + ") failed: " + cause.getMessage(), cause);
        this.commandIndex = commandIndex;
        this.verb = verb;
        this.uid = uid;
    }

    public int commandIndex() {
        return commandIndex;
    }

    public String verb() {
        return verb;
    }

    public String uid() {
        return uid;
    }

    /** The typed failure of the command. */
    public KgmlException failure() {
        return (KgmlException) getCause();
    }

    @Override
    public ErrorKind kind() {
        return failure().kind();
    }
}
