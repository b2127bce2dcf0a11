package com.hcltech.dawg.tools;

import com.hcltech.dawg.graph.GraphStats;

/** Summary printed by {@link DawgApp} after minimization. */
public record GraphReport(
        String lexicon,
        long words,
        int nodesBefore,
        int nodesAfter,
        int transitionsBefore,
        int transitionsAfter,
        long fusedGroups,
        double compression,   // nodesAfter / nodesBefore
        long minimizeMillis
) {

    public static GraphReport of(String lexicon, GraphStats before, GraphStats after, long fusedGroups, long minimizeMillis) {
        return new GraphReport(
                lexicon,
                after.words(),
                before.nodes(),
                after.nodes(),
                before.transitions(),
                after.transitions(),
                fusedGroups,
                after.nodes() / (double) before.nodes(),
                minimizeMillis);
    }
}
