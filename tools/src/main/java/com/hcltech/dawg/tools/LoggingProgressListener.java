package com.hcltech.dawg.tools;

import com.hcltech.dawg.graph.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/** Emits one line each time progress enters a new {@code step}-wide bucket. */
public final class LoggingProgressListener implements ProgressListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final double step;
    private final Consumer<String> sink;
    private long lastBucket;

    public LoggingProgressListener(double step) {
        this(step, log::info);
    }

    public LoggingProgressListener(double step, Consumer<String> sink) {
        if (!(step > 0 && step <= 1)) throw new IllegalArgumentException("step must be in (0, 1] but was " + step);
        this.step = step;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void onProgress(double fraction) {
        long bucket = (long) Math.floor(fraction / step + 1e-9);
        if (bucket <= lastBucket) return;
        lastBucket = bucket;
        sink.accept("Minimizing: " + Math.round(fraction * 100) + "%");
    }
}
