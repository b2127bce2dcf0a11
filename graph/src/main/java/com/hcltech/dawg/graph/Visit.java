package com.hcltech.dawg.graph;

/** A node reached by a traversal, with the symbols read from the root to get there. */
public record Visit(String prefix, Node node) {}
