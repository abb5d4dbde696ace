package com.reasoning.kgml.engine;

import java.time.Duration;
import java.util.Properties;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Engine settings. Immutable; build with {@link #builder()} or read from
 * {@code kgml.*} system properties.
 *
 * <pre>
 * kgml.workerThreads      = 4      worker pool for synchronous callables in cooperative mode
 * kgml.callTimeoutMillis  = 30000  bound on blocking waits for asynchronous callables
 * kgml.sourceCompilation  = false  allow function nodes to compile their 'code' property
 * kgml.ringBufferSize     = 1024   dispatcher capacity, a power of two
 * kgml.maxLoopIterations  = 100    bound on the body runs of one LOOP► statement
 * kgml.historyDepth       = 16     revisions kept per node and per edge
 * </pre>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class KgmlConfig {
    public static final String PREFIX = "kgml.";

    @Builder.Default
    private final int workerThreads = 4;
    @Builder.Default
    private final Duration callTimeout = Duration.ofSeconds(30);
    @Builder.Default
    private final boolean sourceCompilation = false;
    @Builder.Default
    private final int ringBufferSize = 1024;
    @Builder.Default
    private final int maxLoopIterations = 100;
    @Builder.Default
    private final int historyDepth = 16;

    public static KgmlConfig defaults() {
        return builder().build();
    }

    public static KgmlConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads {@code kgml.*} keys; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException on unparsable or out-of-range values
     */
    public static KgmlConfig fromProperties(Properties props) {
        KgmlConfig defaults = defaults();
        try {
            return builder()
                    .workerThreads(Integer.parseInt(props.getProperty(PREFIX + "workerThreads",
                            String.valueOf(defaults.workerThreads))))
                    .callTimeout(Duration.ofMillis(Long.parseLong(props.getProperty(PREFIX + "callTimeoutMillis",
                            String.valueOf(defaults.callTimeout.toMillis())))))
                    .sourceCompilation(Boolean.parseBoolean(props.getProperty(PREFIX + "sourceCompilation",
                            String.valueOf(defaults.sourceCompilation))))
                    .ringBufferSize(Integer.parseInt(props.getProperty(PREFIX + "ringBufferSize",
                            String.valueOf(defaults.ringBufferSize))))
                    .maxLoopIterations(Integer.parseInt(props.getProperty(PREFIX + "maxLoopIterations",
                            String.valueOf(defaults.maxLoopIterations))))
                    .historyDepth(Integer.parseInt(props.getProperty(PREFIX + "historyDepth",
                            String.valueOf(defaults.historyDepth))))
                    .build()
                    .validate();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid kgml.* property: " + e.getMessage(), e);
        }
    }

    /**
     * @return this
     * @throws IllegalArgumentException if a setting is out of range
     */
    public KgmlConfig validate() {
        if (workerThreads <= 0)
            throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
        if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero())
            throw new IllegalArgumentException("callTimeout must be positive: " + callTimeout);
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of two: " + ringBufferSize);
        if (maxLoopIterations <= 0)
            throw new IllegalArgumentException("maxLoopIterations must be positive: " + maxLoopIterations);
        if (historyDepth <= 0)
            throw new IllegalArgumentException("historyDepth must be positive: " + historyDepth);
        return this;
    }
}
