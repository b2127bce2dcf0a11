package com.hcltech.dawg.graph;

import com.hcltech.dawg.common.metrics.Metrics;
import com.hcltech.dawg.graph.exceptions.GraphMinimizedException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Deterministic acyclic graph recognizing a finite set of words.
 * <p>
 * Words are inserted into a trie. Once every word is in, {@link #minimize()} fuses equivalent suffixes and turns
 * the trie into a minimal acyclic word graph; from then on the graph is read-only.
 * <p>
 * Not thread-safe.
 */
public final class WordGraph {
    private NodeArena arena;
    private Node root;
    private boolean minimized;

    public WordGraph() {
        this.arena = new NodeArena();
        this.root = arena.create(Map.of());
    }

    /**
     * Adds {@code word} to the recognized language.
     *
     * @return true if the word was not recognized before
     * @throws GraphMinimizedException if the graph has been minimized
     */
    public boolean insert(String word) {
        Objects.requireNonNull(word, "word");
        if (minimized) throw new GraphMinimizedException("Cannot insert '" + word + "': the graph is minimized");
        Node node = root;
        for (int i = 0; i < word.length(); i++) {
            node = node.transitionOn(word.charAt(i), true);
        }
        boolean added = !node.isAccepting();
        node.markAccepting();
        return added;
    }

    /** @return the number of words that were new */
    public int insertAll(Iterable<String> words) {
        Objects.requireNonNull(words, "words");
        if (minimized) throw new GraphMinimizedException("Cannot insert words: the graph is minimized");
        int added = 0;
        for (String word : words) {
            if (insert(word)) added++;
        }
        return added;
    }

    public boolean accepts(String word) {
        Objects.requireNonNull(word, "word");
        Optional<Node> node = Optional.of(root);
        for (int i = 0; i < word.length() && node.isPresent(); i++) {
            char symbol = word.charAt(i);
            node = node.get().target(symbol);
        }
        return node.map(Node::isAccepting).orElse(false);
    }

    /** Lazy and restartable: every call to {@code iterator()} starts a fresh walk from the root. */
    public Iterable<Visit> traverse(TraversalMode mode) {
        Objects.requireNonNull(mode, "mode");
        return () -> new Traversal(root, mode);
    }

    /** Every distinct node reachable from the root, root first. */
    public Iterable<Node> nodes() {
        return () -> stream(TraversalMode.IDENTITY).map(Visit::node).iterator();
    }

    /** Every recognized word, in lexicographic (UTF-16) order. */
    public Iterable<String> words() {
        return () -> stream(TraversalMode.PATH)
                .filter(v -> v.node().isAccepting())
                .map(Visit::prefix)
                .iterator();
    }

    /** Distinct nodes without outgoing transitions, whether accepting or not. */
    public Set<Node> leaves() {
        Set<Node> leaves = new LinkedHashSet<>();
        for (Node node : nodes()) {
            if (node.isLeaf()) leaves.add(node);
        }
        return Collections.unmodifiableSet(leaves);
    }

    public long countWords() {
        return stream(TraversalMode.PATH).filter(v -> v.node().isAccepting()).count();
    }

    public int countNodes() {
        return (int) stream(TraversalMode.IDENTITY).count();
    }

    /** Assigns display ordinals 0..n-1 in traversal order. Has no other effect. */
    public void renumber() {
        int ordinal = 0;
        for (Node node : nodes()) {
            node.ordinal(ordinal++);
        }
    }

    public GraphStats stats() {
        int nodes = 0;
        int transitions = 0;
        int leaves = 0;
        for (Node node : nodes()) {
            nodes++;
            transitions += node.transitions().size();
            if (node.isLeaf()) leaves++;
        }
        return new GraphStats(countWords(), nodes, transitions, leaves, minimized);
    }

    public String dump() {
        return GraphDump.render(this);
    }

    public void minimize() {
        minimize(ProgressListener.none());
    }

    public void minimize(ProgressListener listener) {
        new Minimizer(Metrics.nullMetrics, listener).minimize(this);
    }

    public Node root() {
        return root;
    }

    public boolean isMinimized() {
        return minimized;
    }

    // --- package-private support for NodeFuser and Minimizer ---

    NodeArena arena() {
        return arena;
    }

    void replaceRoot(Node newRoot) {
        this.root = newRoot;
    }

    /** Deep copy into a fresh arena. Shared nodes stay shared in the copy. */
    WordGraph copy() {
        WordGraph copy = new WordGraph();
        Map<Node, Node> copies = new LinkedHashMap<>();
        copies.put(root, copy.root);
        for (Node node : nodes()) {
            Node twin = copies.computeIfAbsent(node, n -> copy.arena.create(Map.of()));
            if (node.isAccepting()) twin.markAccepting();
        }
        for (Map.Entry<Node, Node> entry : copies.entrySet()) {
            entry.getKey().transitions().forEach((symbol, target) -> entry.getValue().link(symbol, copies.get(target)));
        }
        copy.minimized = minimized;
        return copy;
    }

    /** Takes over the structure of a minimized working copy. Its arena is frozen from then on. */
    void adoptMinimized(WordGraph working) {
        working.arena.freeze();
        this.arena = working.arena;
        this.root = working.root;
        this.minimized = true;
    }

    private Stream<Visit> stream(TraversalMode mode) {
        return StreamSupport.stream(traverse(mode).spliterator(), false);
    }
}
