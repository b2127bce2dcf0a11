package com.hcltech.dawg.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A vertex of a {@link WordGraph}.
 * <p>
 * Outgoing transitions are owned references keyed by symbol, at most one target per symbol.
 * Incoming links are recorded as the parent's arena handle together with the symbols the parent
 * uses to reach this node. They exist for minimization bookkeeping only and never keep a parent alive.
 * <p>
 * Equality is identity. The {@link #ordinal()} is for display and may be reassigned by {@link WordGraph#renumber()}.
 */
public final class Node {
    private final NodeArena arena;
    private final int handle;
    private int ordinal;
    private boolean accepting;
    private final TreeMap<Character, Node> transitions = new TreeMap<>();
    private final Map<Integer, Set<Character>> parents = new LinkedHashMap<>();

    Node(NodeArena arena, int handle) {
        this.arena = arena;
        this.handle = handle;
        this.ordinal = handle;
    }

    /**
     * Returns the target reached on {@code symbol}. When there is none and {@code createIfMissing} is set, a new
     * node is created, registered as the target and linked back to this node; otherwise {@code null} is returned.
     *
     * @throws com.hcltech.dawg.graph.exceptions.GraphMinimizedException if a node has to be created in a minimized graph
     */
    public Node transitionOn(char symbol, boolean createIfMissing) {
        Node target = transitions.get(symbol);
        if (target == null && createIfMissing) {
            target = arena.create(Map.of(this, Set.of(symbol)));
            transitions.put(symbol, target);
        }
        return target;
    }

    public Optional<Node> target(char symbol) {
        return Optional.ofNullable(transitions.get(symbol));
    }

    public boolean isAccepting() {
        return accepting;
    }

    public boolean isLeaf() {
        return transitions.isEmpty();
    }

    /** Read-only view, ordered by symbol. */
    public SortedMap<Character, Node> transitions() {
        return Collections.unmodifiableSortedMap(transitions);
    }

    /** Read-only view: parent handle to the symbols on which that parent points here. */
    public Map<Integer, Set<Character>> parentHandles() {
        return Collections.unmodifiableMap(parents);
    }

    public int handle() {
        return handle;
    }

    public int ordinal() {
        return ordinal;
    }

    // --- package-private mutators used by WordGraph, NodeArena and NodeFuser ---

    void markAccepting() {
        accepting = true;
    }

    void ordinal(int ordinal) {
        this.ordinal = ordinal;
    }

    NavigableMap<Character, Node> descendingTransitions() {
        return transitions.descendingMap();
    }

    /** Adds or replaces a transition and records the back link on the target. */
    void link(char symbol, Node target) {
        transitions.put(symbol, target);
        target.addParent(handle, symbol);
    }

    /** Points an existing symbol at a new target without touching any back links. */
    void redirect(char symbol, Node target) {
        transitions.put(symbol, target);
    }

    void addParent(int parentHandle, char symbol) {
        parents.computeIfAbsent(parentHandle, h -> new TreeSet<>()).add(symbol);
    }

    void removeParent(int parentHandle) {
        parents.remove(parentHandle);
    }

    @Override
    public String toString() {
        return "Node#" + ordinal + (accepting ? "*" : "");
    }
}
