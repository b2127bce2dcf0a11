package com.hcltech.dawg.graph;

public enum TraversalMode {
    /** Each distinct node once, however many paths lead to it. */
    IDENTITY,
    /** Every root-to-node path, so a shared node is visited once per prefix that reaches it. */
    PATH
}
