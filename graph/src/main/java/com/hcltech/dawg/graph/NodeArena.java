package com.hcltech.dawg.graph;

import com.hcltech.dawg.graph.exceptions.GraphMinimizedException;
import com.hcltech.dawg.graph.exceptions.InvariantViolationException;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Allocates node handles and keeps the table of live nodes of one graph.
 * Handles are never reused, so a retired handle can only ever resolve to nothing.
 * A frozen arena belongs to a minimized graph and allocates no more nodes.
 */
final class NodeArena {
    private final Map<Integer, Node> live = new HashMap<>();
    private int nextHandle;
    private boolean frozen;

    /**
     * New non-accepting node with no transitions, whose parent links are seeded from {@code parentLinks}.
     *
     * @throws GraphMinimizedException if the arena is frozen
     */
    Node create(Map<Node, Set<Character>> parentLinks) {
        if (frozen) throw new GraphMinimizedException("Cannot add a node: the graph is minimized");
        Node node = new Node(this, nextHandle++);
        for (Map.Entry<Node, Set<Character>> link : parentLinks.entrySet()) {
            for (char symbol : link.getValue()) {
                node.addParent(link.getKey().handle(), symbol);
            }
        }
        live.put(node.handle(), node);
        return node;
    }

    Node resolve(int handle) {
        Node node = live.get(handle);
        if (node == null) throw new InvariantViolationException("Dangling node handle " + handle);
        return node;
    }

    boolean isLive(Node node) {
        return node != null && live.get(node.handle()) == node;
    }

    void retire(Node node) {
        if (live.remove(node.handle()) == null) {
            throw new InvariantViolationException("Node " + node + " retired twice");
        }
    }

    void freeze() {
        frozen = true;
    }

    int size() {
        return live.size();
    }
}
