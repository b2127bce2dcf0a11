package com.hcltech.dawg.graph;

import com.hcltech.dawg.graph.exceptions.UnsupportedTraversalModeException;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Depth-first, symbol-ordered walk from a start node. Lazy: the next visit is computed on demand.
 * The graph must not be mutated while a traversal is in progress.
 */
final class Traversal implements Iterator<Visit> {
    private final Deque<Visit> stack = new ArrayDeque<>();
    private final Set<Node> seen;
    private Visit next;

    Traversal(Node start, TraversalMode mode) {
        switch (mode) {
            case IDENTITY:
                seen = Collections.newSetFromMap(new IdentityHashMap<>());
                break;
            case PATH:
                seen = null;
                break;
            default:
                throw new UnsupportedTraversalModeException(mode);
        }
        stack.push(new Visit("", start));
        next = advance();
    }

    @Override
    public boolean hasNext() {
        return next != null;
    }

    @Override
    public Visit next() {
        if (next == null) throw new NoSuchElementException();
        Visit result = next;
        next = advance();
        return result;
    }

    private Visit advance() {
        while (!stack.isEmpty()) {
            Visit visit = stack.pop();
            if (seen != null && !seen.add(visit.node())) continue;
            // pushed in reverse so the smallest symbol is popped first
            for (Map.Entry<Character, Node> t : visit.node().descendingTransitions().entrySet()) {
                if (seen == null || !seen.contains(t.getValue())) {
                    stack.push(new Visit(visit.prefix() + t.getKey(), t.getValue()));
                }
            }
            return visit;
        }
        return null;
    }
}
