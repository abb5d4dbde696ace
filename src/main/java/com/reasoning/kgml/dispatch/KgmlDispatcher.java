package com.reasoning.kgml.dispatch;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.reasoning.kgml.dsl.Kgml;
import com.reasoning.kgml.dsl.Program;
import com.reasoning.kgml.engine.ExecutionResult;
import com.reasoning.kgml.engine.KgmlExecutor;
import com.reasoning.kgml.util.ErrorRateLimiter;

import java.util.concurrent.CompletableFuture;

import lombok.extern.log4j.Log4j2;

/**
 * Multi-producer front door for one graph, backed by an LMAX Disruptor ring
 * buffer.
 *
 * <p>
 * Any thread may {@link #submit(String)} programs. A single consumer thread
 * parses and executes them in the order they were published, which keeps all
 * writes to the graph on one thread. Each submission gets its own future;
 * parse and command failures complete it exceptionally and do not affect
 * later programs.
 *
 * <p>
 * When the consumer drains a burst of events it invokes the optional
 * {@link PostBatchCallback}, e.g. to publish a snapshot of the graph once per
 * batch instead of once per program.
 */
@Log4j2
public final class KgmlDispatcher implements AutoCloseable {
    private final KgmlExecutor executor;
    private final Disruptor<ProgramEvent> disruptor;
    private final RingBuffer<ProgramEvent> ringBuffer;
    private final ErrorRateLimiter callbackErrors = new ErrorRateLimiter(log, 1000);
    private volatile PostBatchCallback postBatch;
    private long batchCount;
    private int inBatch;
    private volatile boolean closed;

    public KgmlDispatcher(KgmlExecutor executor, int ringBufferSize) {
        this.executor = executor;
        this.disruptor = new Disruptor<>(
                ProgramEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        EventHandler<ProgramEvent> handler = this::onEvent;
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        log.info("KGML dispatcher started (ring buffer size {})", ringBufferSize);
    }

    public void setPostBatchCallback(PostBatchCallback callback) {
        this.postBatch = callback;
    }

    /**
     * Publishes KGML text for execution. Blocks only while the ring buffer is full.
     */
    public CompletableFuture<ExecutionResult> submit(String kgml) {
        checkOpen();
        CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setText(kgml, result);
        } finally {
            ringBuffer.publish(sequence);
        }
        return result;
    }

    /** Publishes an already parsed program. */
    public CompletableFuture<ExecutionResult> submit(Program program) {
        checkOpen();
        CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setProgram(program, result);
        } finally {
            ringBuffer.publish(sequence);
        }
        return result;
    }

    /** Free slots left in the ring buffer. */
    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    void onEvent(ProgramEvent event, long sequence, boolean endOfBatch) {
        CompletableFuture<ExecutionResult> result = event.result();
        try {
            if (!result.isDone()) {
                Program program = event.program() != null ? event.program() : Kgml.parse(event.text());
                result.complete(executor.execute(program));
            }
        } catch (RuntimeException e) {
            log.debug("Program at sequence {} failed: {}", sequence, e.getMessage());
            result.completeExceptionally(e);
        } finally {
            event.clear();
        }

        inBatch++;
        if (endOfBatch) {
            batchCount++;
            PostBatchCallback cb = postBatch;
            if (cb != null) {
                try {
                    cb.onBatch(batchCount, inBatch);
                } catch (RuntimeException e) {
                    callbackErrors.log("Post-batch callback failed for batch " + batchCount, e);
                }
            }
            inBatch = 0;
        }
    }

    private void checkOpen() {
        if (closed)
            throw new IllegalStateException("Dispatcher is closed");
    }

    /** Stops accepting programs, waits for queued ones to finish and stops the consumer. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
        log.info("KGML dispatcher stopped after {} batches", batchCount);
    }

    /**
     * Invoked on the consumer thread after the last program of a batch. A
     * throwing callback is logged and the consumer keeps running.
     */
    @FunctionalInterface
    public interface PostBatchCallback {
        /**
         * @param batch    running batch number, starting at 1
         * @param programs number of programs in the batch
         */
        void onBatch(long batch, int programs);
    }
}
