package com.hcltech.dawg.common.metrics;

/**
 * Minimal façade for emitting numeric metrics.
 * <p>Both counters and histograms share the same low-cardinality naming space.</p>
 */
public interface Metrics {

    /** Increment a named counter by 1. */
    void increment(String name);

    /** Increment a named counter by {@code delta}. */
    default void increment(String name, long delta) {
        for (long i = 0; i < delta; i++) increment(name);
    }

    /**
     * Record a value in a histogram/timer.
     * <p>Typical use: record durations or sizes in milliseconds/counts.</p>
     */
    void histogram(String name, long value);

    Metrics nullMetrics = new NullMetrics();
}

class NullMetrics implements Metrics {

    @Override
    public void increment(String name) {
    }

    @Override
    public void increment(String name, long delta) {
    }

    @Override
    public void histogram(String name, long value) {
    }
}
