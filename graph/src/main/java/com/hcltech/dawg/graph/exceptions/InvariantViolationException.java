package com.hcltech.dawg.graph.exceptions;

/** A broken internal invariant of the word graph. Never recoverable. */
public final class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) { super(message); }
}
