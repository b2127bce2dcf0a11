package com.hcltech.dawg.graph.exceptions;

/** Thrown when a structural change is attempted on a graph that has already been minimized. */
public final class GraphMinimizedException extends IllegalStateException {
    public GraphMinimizedException(String message) { super(message); }
}
