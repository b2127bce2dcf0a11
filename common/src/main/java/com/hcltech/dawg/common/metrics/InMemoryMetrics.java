package com.hcltech.dawg.common.metrics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class InMemoryMetrics implements Metrics {
    public final Map<String, Long> counters = new HashMap<>();
    public final Map<String, List<Long>> histograms = new HashMap<>();

    @Override
    public synchronized void increment(String name) {
        counters.merge(name, 1L, Long::sum);
    }

    @Override
    public synchronized void increment(String name, long delta) {
        counters.merge(name, delta, Long::sum);
    }

    @Override
    public synchronized void histogram(String name, long value) {
        histograms.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
    }

    public synchronized long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }
}
