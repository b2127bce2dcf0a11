package com.hcltech.dawg.graph;

import com.hcltech.dawg.graph.exceptions.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Replaces a set of equivalent nodes of one graph by a single new node.
 * <p>
 * Every check runs before the first mutation, so a rejected fuse leaves the graph exactly as it was.
 */
final class NodeFuser {
    private static final Logger log = LoggerFactory.getLogger(NodeFuser.class);

    private final WordGraph graph;

    NodeFuser(WordGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * @throws IllegalArgumentException     for an empty set, mixed acceptance, or nodes of another graph
     * @throws InvariantViolationException if two members disagree on the target of a symbol
     */
    Node fuse(Set<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        if (nodes.isEmpty()) throw new IllegalArgumentException("Cannot fuse an empty set of nodes");
        NodeArena arena = graph.arena();

        Boolean accepting = null;
        SortedMap<Character, Node> union = new TreeMap<>();
        for (Node member : nodes) {
            if (!arena.isLive(member)) {
                throw new IllegalArgumentException("Node " + member + " is not part of this graph");
            }
            if (accepting == null) {
                accepting = member.isAccepting();
            } else if (accepting != member.isAccepting()) {
                throw new IllegalArgumentException("Cannot fuse nodes with mixed acceptance: " + nodes);
            }
            for (Map.Entry<Character, Node> t : member.transitions().entrySet()) {
                Node previous = union.putIfAbsent(t.getKey(), t.getValue());
                if (previous != null && previous != t.getValue()) {
                    throw new InvariantViolationException("Nodes " + nodes + " disagree on symbol '" + t.getKey()
                            + "': " + previous + " vs " + t.getValue());
                }
            }
        }

        Map<Node, Set<Character>> parentLinks = new LinkedHashMap<>();
        for (Node member : nodes) {
            for (Map.Entry<Integer, Set<Character>> link : member.parentHandles().entrySet()) {
                Node parent = arena.resolve(link.getKey());
                parentLinks.computeIfAbsent(parent, p -> new TreeSet<>()).addAll(link.getValue());
            }
        }

        // --- validated; mutate from here on ---
        Node fused = arena.create(parentLinks);
        if (accepting) fused.markAccepting();
        for (Node member : nodes) {
            for (Node child : member.transitions().values()) {
                child.removeParent(member.handle());
            }
        }
        union.forEach(fused::link);
        parentLinks.forEach((parent, symbols) -> symbols.forEach(symbol -> parent.redirect(symbol, fused)));
        if (nodes.contains(graph.root())) graph.replaceRoot(fused);
        for (Node member : nodes) {
            arena.retire(member);
        }

        log.debug("Fused {} nodes into {} ({} transitions, {} parents)", nodes.size(), fused, union.size(), parentLinks.size());
        return fused;
    }
}
