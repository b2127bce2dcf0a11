package com.hcltech.dawg.graph;

/** Point-in-time counts describing a word graph. */
public record GraphStats(long words, int nodes, int transitions, int leaves, boolean minimized) {}
