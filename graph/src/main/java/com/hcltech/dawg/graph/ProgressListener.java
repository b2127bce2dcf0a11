package com.hcltech.dawg.graph;

/**
 * Advisory progress callback for long running graph operations.
 * Receives a non-decreasing completion estimate in {@code [0, 1]}.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(double fraction);

    static ProgressListener none() {
        return fraction -> {
        };
    }
}
