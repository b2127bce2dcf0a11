package com.hcltech.dawg.graph;

import java.util.Map;

/**
 * Debug rendering of a word graph, one line per distinct node:
 * <pre>
 * 0 b:1
 * 1 a:2
 * 2 d:3 t:3
 * 3*
 * </pre>
 * The ordinal comes first, {@code *} marks an accepting node, then {@code symbol:targetOrdinal} for each transition
 * in symbol order. Not a persistence format.
 */
public final class GraphDump {
    private GraphDump() {}

    /** Renumbers the graph so ordinals are consecutive, then renders it. */
    public static String render(WordGraph graph) {
        graph.renumber();
        StringBuilder sb = new StringBuilder();
        for (Node node : graph.nodes()) {
            sb.append(node.ordinal());
            if (node.isAccepting()) sb.append('*');
            for (Map.Entry<Character, Node> t : node.transitions().entrySet()) {
                sb.append(' ').append(t.getKey()).append(':').append(t.getValue().ordinal());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
