package com.timetree.model;

import java.util.List;
import java.util.Map;

/**
 * Everything an external renderer needs to draw a tree. Recomputed on demand, never stored on the tree.
 *
 * When the tree has an origin, {@code stem} runs from the origin to the root along the root's row.
 * The origin is older than every node, so the stem starts at a negative x.
 */
public record LayoutResult(
    int rootId,
    double maxAge,
    int leafCount,
    Map<Integer, NodePosition> positions,   // keyed by node id, in pre-order
    List<EdgePath> edges,                   // one per non-root node, in pre-order
    Double origin,                          // null when the tree has no origin
    List<Point> stem                        // empty when the tree has no origin
) {
    public NodePosition position(int nodeId) {
        return positions.get(nodeId);
    }

    public boolean hasStem() {
        return !stem.isEmpty();
    }
}
