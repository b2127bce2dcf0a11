package com.hcltech.dawg.graph.exceptions;

import com.hcltech.dawg.graph.TraversalMode;

public final class UnsupportedTraversalModeException extends UnsupportedOperationException {
    public UnsupportedTraversalModeException(TraversalMode mode) { super("Unsupported traversal mode: " + mode); }
}
