package com.timetree.model;

import java.util.List;

/**
 * Orthogonal connector from a child up to its parent: horizontal run at the child's row,
 * then vertical run at the parent's x.
 */
public record EdgePath(
    int childId,
    int parentId,
    List<Point> points
) {
}
