package com.reasoning.kgml.dispatch;

import com.reasoning.kgml.dsl.Program;
import com.reasoning.kgml.engine.ExecutionResult;

import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot carrying one submitted program.
 *
 * <p>
 * Instances are pre-allocated by the ring buffer and reused. A slot holds
 * either KGML text, parsed on the consumer thread, or an already parsed
 * {@link Program}, plus the future the submitter waits on. The consumer
 * clears the slot after use so finished programs are not retained.
 */
public final class ProgramEvent {
    private String text;
    private Program program;
    private CompletableFuture<ExecutionResult> result;
    private long submittedNanos;

    void setText(String text, CompletableFuture<ExecutionResult> result) {
        this.text = text;
        this.program = null;
        this.result = result;
        this.submittedNanos = System.nanoTime();
    }

    void setProgram(Program program, CompletableFuture<ExecutionResult> result) {
        this.text = null;
        this.program = program;
        this.result = result;
        this.submittedNanos = System.nanoTime();
    }

    public String text() {
        return text;
    }

    public Program program() {
        return program;
    }

    public CompletableFuture<ExecutionResult> result() {
        return result;
    }

    public long submittedNanos() {
        return submittedNanos;
    }

    public void clear() {
        text = null;
        program = null;
        result = null;
        submittedNanos = 0;
    }
}
