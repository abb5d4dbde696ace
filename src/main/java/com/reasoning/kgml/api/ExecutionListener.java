package com.reasoning.kgml.api;

import com.reasoning.kgml.dsl.Command;
import com.reasoning.kgml.engine.CommandResult;
import com.reasoning.kgml.error.KgmlException;

/**
 * Observability interface for monitoring program execution.
 *
 * Implementations are registered with the executor and receive callbacks on
 * the executing thread. This is the hook for audit trails, profiling and
 * debugging of KGML programs produced upstream.
 */
public interface ExecutionListener {

    /**
     * Called before the first command of a program runs.
     *
     * @param programId    sequence number of the program on this executor
     * @param commandCount number of commands in the program
     */
    void onProgramStart(long programId, int commandCount);

    /**
     * Called after a command was applied.
     *
     * @param programId     sequence number of the program
     * @param result        what the command did
     * @param durationNanos wall time spent on the command, cascades included
     */
    void onCommandExecuted(long programId, CommandResult result, long durationNanos);

    /**
     * Called when a command fails. The program stops after this callback.
     */
    void onCommandError(long programId, int commandIndex, Command command, KgmlException error);

    /**
     * Called when a program finished, successfully or not.
     *
     * @param commandsApplied number of commands that were applied
     */
    void onProgramEnd(long programId, int commandsApplied);
}
