package com.reasoning.kgml.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a repeating failure is logged, e.g. a graph listener that
 * throws on every mutation. Suppressed occurrences are counted and reported
 * with the next message that gets through.
 */
public final class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    public void log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // Only one thread wins the slot per interval
        if ((last == Long.MIN_VALUE || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.error("{} ({} similar errors suppressed)", message, skipped, t);
            else
                logger.error(message, t);
        } else {
            suppressed.incrementAndGet();
        }
    }

    /** Occurrences dropped since the last logged one. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
