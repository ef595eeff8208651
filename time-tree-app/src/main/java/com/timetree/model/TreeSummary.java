package com.timetree.model;

/**
 * Compact description of a tree returned to API callers.
 */
public record TreeSummary(
    String newick,
    double rootAge,
    Double origin,
    int nodeCount,
    int leafCount,
    boolean ultrametric
) {
}
