package com.reasoning.kgml.util;

import com.reasoning.kgml.api.ExecutionListener;
import com.reasoning.kgml.dsl.Command;
import com.reasoning.kgml.engine.CommandResult;
import com.reasoning.kgml.error.KgmlException;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link ExecutionListener}s in registration
 * order. Listeners are held in an array that is replaced on every add, so
 * iteration needs no lock.
 */
public final class CompositeExecutionListener implements ExecutionListener {
    private volatile ExecutionListener[] listeners = new ExecutionListener[0];

    public synchronized void add(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized boolean remove(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                ExecutionListener[] next = new ExecutionListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onProgramStart(long programId, int commandCount) {
        for (ExecutionListener l : listeners)
            l.onProgramStart(programId, commandCount);
    }

    @Override
    public void onCommandExecuted(long programId, CommandResult result, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onCommandExecuted(programId, result, durationNanos);
    }

    @Override
    public void onCommandError(long programId, int commandIndex, Command command, KgmlException error) {
        for (ExecutionListener l : listeners)
            l.onCommandError(programId, commandIndex, command, error);
    }

    @Override
    public void onProgramEnd(long programId, int commandsApplied) {
        for (ExecutionListener l : listeners)
            l.onProgramEnd(programId, commandsApplied);
    }
}
