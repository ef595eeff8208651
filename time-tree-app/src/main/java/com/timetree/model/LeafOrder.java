package com.timetree.model;

/**
 * How leaves are assigned to rows in a chronogram layout.
 */
public enum LeafOrder {
    /** Pre-order traversal order, i.e. the child order of the tree. */
    INPUT,
    /** Alphabetical by label; unlabeled leaves go last, ties keep traversal order. */
    LABEL
}
