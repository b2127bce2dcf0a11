package com.hcltech.dawg.graph;

import com.hcltech.dawg.common.metrics.Metrics;
import com.hcltech.dawg.graph.exceptions.GraphMinimizedException;
import com.hcltech.dawg.graph.exceptions.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a trie into a minimal acyclic word graph in one bottom-up pass.
 * <p>
 * Leaves are settled first. A node becomes a candidate once every one of its children is settled; candidates
 * found in the same step are grouped by {@link Signature} and each group is fused into one node. Because the
 * trie is acyclic, equivalent nodes always become candidates in the same step: they point at the same settled
 * children and so are released by the same last child.
 * <p>
 * The pass runs on a copy of the graph. The graph only takes over the result once the pass and its telemetry have
 * completed, so a failure anywhere leaves it the unminimized trie it was.
 */
public final class Minimizer {
    private static final Logger log = LoggerFactory.getLogger(Minimizer.class);

    public static final String FUSED_GROUPS = "dawg.minimize.fused.groups";
    public static final String FUSED_NODES = "dawg.minimize.fused.nodes";
    public static final String MINIMIZE_MILLIS = "dawg.minimize.millis";

    private final Metrics metrics;
    private final ProgressListener listener;

    public Minimizer(Metrics metrics, ProgressListener listener) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * @throws GraphMinimizedException if {@code graph} is already minimized
     */
    public void minimize(WordGraph graph) {
        Objects.requireNonNull(graph, "graph");
        if (graph.isMinimized()) throw new GraphMinimizedException("The graph is already minimized");

        long start = System.currentTimeMillis();
        int before = graph.countNodes();
        log.info("Minimizing word graph with {} nodes", before);

        WordGraph working = graph.copy();
        run(working, before);
        int after = working.countNodes();
        if (working.arena().size() != after) {
            throw new InvariantViolationException(
                    "Arena holds " + working.arena().size() + " live nodes but " + after + " are reachable");
        }

        long millis = System.currentTimeMillis() - start;
        metrics.histogram(MINIMIZE_MILLIS, millis);
        listener.onProgress(1.0);

        graph.adoptMinimized(working);
        log.info("Minimized word graph: {} -> {} nodes in {} ms", before, after, millis);
    }

    private void run(WordGraph working, int before) {
        NodeFuser fuser = new NodeFuser(working);
        NodeArena arena = working.arena();
        Deque<Node> queue = new ArrayDeque<>();
        Set<Node> finalized = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<Node> emitted = Collections.newSetFromMap(new IdentityHashMap<>());

        // accepting and non-accepting leaves are never equivalent, so they are fused separately
        Map<Boolean, Set<Node>> leavesByAcceptance = new LinkedHashMap<>();
        for (Node leaf : working.leaves()) {
            leavesByAcceptance.computeIfAbsent(leaf.isAccepting(), a -> new LinkedHashSet<>()).add(leaf);
        }
        for (Set<Node> leaves : leavesByAcceptance.values()) {
            emit(represent(fuser, leaves), queue, emitted);
        }

        double reported = 0;
        while (!queue.isEmpty()) {
            Node settled = queue.poll();
            finalized.add(settled);

            Map<Signature, Set<Node>> groups = new LinkedHashMap<>();
            for (Integer parentHandle : List.copyOf(settled.parentHandles().keySet())) {
                Node parent = arena.resolve(parentHandle);
                if (emitted.contains(parent)) continue;
                if (!finalized.containsAll(parent.transitions().values())) continue;
                groups.computeIfAbsent(Signature.of(parent), s -> new LinkedHashSet<>()).add(parent);
            }
            for (Set<Node> group : groups.values()) {
                emit(represent(fuser, group), queue, emitted);
            }

            double fraction = Math.min(1.0, finalized.size() / (double) before);
            if (fraction > reported) {
                reported = fraction;
                listener.onProgress(fraction);
            }
        }
    }

    private Node represent(NodeFuser fuser, Set<Node> group) {
        if (group.size() == 1) return group.iterator().next();
        metrics.increment(FUSED_GROUPS);
        metrics.increment(FUSED_NODES, group.size());
        return fuser.fuse(group);
    }

    private static void emit(Node representative, Deque<Node> queue, Set<Node> emitted) {
        if (emitted.add(representative)) queue.add(representative);
    }
}
