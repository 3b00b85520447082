package org.carball.tiercheck.analyzer;

/**
 * How {@link DependencyGraph#longestPathDepth(CycleBreakPolicy)} treats an edge back to a node
 * that is still being explored.
 */
public enum CycleBreakPolicy {

    /**
     * The node on the stack counts as a leaf of depth 0, so the back edge still adds one level.
     */
    COUNT_BACK_EDGE_AS_LEAF,

    /**
     * The back edge is skipped and adds nothing to the depth.
     */
    IGNORE_BACK_EDGE
}
