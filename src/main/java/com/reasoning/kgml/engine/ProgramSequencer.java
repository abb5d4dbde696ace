package com.reasoning.kgml.engine;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out turns so that programs against one graph run strictly one after
 * another, whether they block or not.
 *
 * <p>
 * {@link #enter()} never blocks: it queues a {@link Ticket} behind the last
 * one handed out. The ticket's {@code ready} future completes when every
 * earlier ticket has been released. Every ticket must be released exactly
 * once, even if its program never ran.
 */
final class ProgramSequencer {
    private final AtomicReference<CompletableFuture<Void>> tail =
            new AtomicReference<>(CompletableFuture.completedFuture(null));

    record Ticket(CompletableFuture<Void> ready, CompletableFuture<Void> finished) {

        /** Blocks the calling thread until it is this ticket's turn. */
        void awaitTurn() {
            ready.join();
        }

        void release() {
            finished.complete(null);
        }
    }

    Ticket enter() {
        CompletableFuture<Void> finished = new CompletableFuture<>();
        CompletableFuture<Void> previous = tail.getAndSet(finished);
        return new Ticket(previous, finished);
    }

    /** True when no program holds or waits for a turn. */
    boolean isIdle() {
        return tail.get().isDone();
    }
}
