package com.timetree.model;

/**
 * Plotting position of one node.
 * x runs along the time axis (root side at 0), y along the leaf ordering axis.
 */
public record NodePosition(
    int id,
    String label,
    double age,
    double x,
    double y,
    boolean leaf,
    boolean singleChild   // internal node with exactly one child, drawn as a sampled ancestor
) {
}
