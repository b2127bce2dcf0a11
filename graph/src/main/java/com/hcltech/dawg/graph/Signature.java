package com.hcltech.dawg.graph;

import java.util.Map;
import java.util.TreeMap;

/**
 * Equivalence key used during minimization: acceptance plus every outgoing (symbol, target) pair.
 * Targets are compared by arena handle, so two nodes share a signature only when they point at the
 * very same already-settled children.
 */
record Signature(boolean accepting, Map<Character, Integer> targets) {

    static Signature of(Node node) {
        Map<Character, Integer> targets = new TreeMap<>();
        node.transitions().forEach((symbol, target) -> targets.put(symbol, target.handle()));
        return new Signature(node.isAccepting(), targets);
    }
}
