package com.reasoning.kgml.util;

import com.reasoning.kgml.api.ExecutionListener;
import com.reasoning.kgml.dsl.Command;
import com.reasoning.kgml.engine.CommandResult;
import com.reasoning.kgml.error.KgmlException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Audit trail of executed commands.
 *
 * <p>
 * Keeps one {@link Entry} per executed or failed command, up to a fixed
 * capacity after which the oldest entries are dropped. Every entry is also
 * written to the {@code kgml.audit} logger at INFO.
 */
public final class ExecutionLog implements ExecutionListener {
    private static final Logger audit = LogManager.getLogger("kgml.audit");

    /** One audited command. {@code error} is null for successful commands. */
    public record Entry(long programId, int commandIndex, String verb, String uid, String outcome,
            long durationNanos, String error) {
    }

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private long programs;
    private long failures;

    public ExecutionLog() {
        this(10_000);
    }

    public ExecutionLog(int capacity) {
        if (capacity <= 0)
            throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
    }

    @Override
    public synchronized void onProgramStart(long programId, int commandCount) {
        programs++;
        audit.debug("program={} start commands={}", programId, commandCount);
    }

    @Override
    public void onCommandExecuted(long programId, CommandResult result, long durationNanos) {
        append(new Entry(programId, result.index(), result.verb().marker(), result.uid(), result.status().name(),
                durationNanos, null));
        audit.info("program={} #{} {} {} -> {} ({} us)", programId, result.index(), result.verb().marker(),
                result.uid(), result.status(), durationNanos / 1000);
    }

    @Override
    public void onCommandError(long programId, int commandIndex, Command command, KgmlException error) {
        synchronized (this) {
            failures++;
        }
        append(new Entry(programId, commandIndex, command.verb().marker(), command.target(), "FAILED", 0,
                error.kind() + ": " + error.getMessage()));
        audit.info("program={} #{} {} {} -> FAILED {}", programId, commandIndex, command.verb().marker(),
                command.target(), error.kind());
    }

    @Override
    public void onProgramEnd(long programId, int commandsApplied) {
        audit.debug("program={} end applied={}", programId, commandsApplied);
    }

    private synchronized void append(Entry entry) {
        if (entries.size() == capacity)
            entries.pollFirst();
        entries.addLast(entry);
    }

    public synchronized List<Entry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized long programCount() {
        return programs;
    }

    public synchronized long failureCount() {
        return failures;
    }

    public synchronized void clear() {
        entries.clear();
        programs = 0;
        failures = 0;
    }

    /** Tabular rendering of the trail, one command per line. */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-8s | %-5s | %-8s | %-20s | %-10s | %10s%n", "Program", "Cmd", "Verb", "Uid",
                "Outcome", "Time (us)"));
        sb.append("-".repeat(76)).append('\n');
        for (Entry e : entries) {
            sb.append(String.format("%-8d | %-5d | %-8s | %-20s | %-10s | %10.1f%n", e.programId(), e.commandIndex(),
                    e.verb(), e.uid(), e.outcome(), e.durationNanos() / 1000.0));
            if (e.error() != null)
                sb.append("         ").append(e.error()).append('\n');
        }
        return sb.toString();
    }
}
