package com.timetree.service;

import com.timetree.config.TimeTreeConfig;
import com.timetree.model.*;
import com.timetree.model.TimeTreeException.EmptyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Assigns plotting coordinates to every node of a time tree.
 *
 * x = maxAge - age, so the oldest node sits at x = 0 and time runs left to right.
 * Leaves take rows 0, 1, 2 ... in the requested order and every internal node sits at the
 * arithmetic mean of its children's rows. Edges are drawn as orthogonal connectors, and a tree
 * with an origin also gets a horizontal stem leading into the root.
 *
 * The result depends only on ages, topology and child order.
 */
@Service
public class ChronogramLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(ChronogramLayoutEngine.class);

    private final TimeTreeConfig config;

    public ChronogramLayoutEngine(TimeTreeConfig config) {
        this.config = config;
    }

    public LayoutResult layout(TimeTree tree) {
        return layout(tree, config.getLayout().getLeafOrder());
    }

    /**
     * @throws EmptyTree when there is nothing to lay out
     * @throws TimeTreeException.InconsistentTree when the tree fails validation
     */
    public LayoutResult layout(TimeTree tree, LeafOrder leafOrder) {
        if (tree == null || tree.root() == null || tree.size() == 0) {
            throw new EmptyTree("Cannot lay out an empty tree");
        }
        tree.validate();

        List<Node> preOrder = new ArrayList<>();
        tree.nodes().forEach(preOrder::add);
        double maxAge = tree.maxAge();

        // Rows
        Map<Node, Double> rows = new HashMap<>();
        List<Node> leaves = orderLeaves(tree.leaves(), leafOrder == null ? LeafOrder.INPUT : leafOrder);
        for (int i = 0; i < leaves.size(); i++) {
            rows.put(leaves.get(i), (double) i);
        }
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            Node node = preOrder.get(i);
            if (node.isLeaf()) {
                continue;
            }
            double sum = 0.0;
            for (Node child : node.getChildren()) {
                sum += rows.get(child);
            }
            rows.put(node, sum / node.getChildren().size());
        }

        Map<Integer, NodePosition> positions = new LinkedHashMap<>();
        List<EdgePath> edges = new ArrayList<>();
        for (Node node : preOrder) {
            double x = maxAge - node.getAge();
            double y = rows.get(node);
            positions.put(node.getId(), new NodePosition(
                    node.getId(), node.getLabel(), node.getAge(), x, y,
                    node.isLeaf(), node.getChildren().size() == 1));
        }
        for (Node node : preOrder) {
            tree.parent(node).ifPresent(parent -> {
                NodePosition child = positions.get(node.getId());
                NodePosition up = positions.get(parent.getId());
                edges.add(new EdgePath(node.getId(), parent.getId(), List.of(
                        new Point(child.x(), child.y()),
                        new Point(up.x(), child.y()),
                        new Point(up.x(), up.y()))));
            });
        }

        Double origin = null;
        List<Point> stem = List.of();
        if (tree.origin().isPresent()) {
            origin = tree.origin().getAsDouble();
            NodePosition root = positions.get(tree.root().getId());
            stem = List.of(new Point(maxAge - origin, root.y()), new Point(root.x(), root.y()));
        }

        log.debug("Laid out {} nodes over {} rows (leaf order {})", positions.size(), leaves.size(), leafOrder);
        return new LayoutResult(tree.root().getId(), maxAge, leaves.size(),
                Collections.unmodifiableMap(positions), List.copyOf(edges), origin, stem);
    }

    private List<Node> orderLeaves(List<Node> leaves, LeafOrder leafOrder) {
        if (leafOrder == LeafOrder.LABEL) {
            List<Node> sorted = new ArrayList<>(leaves);
            sorted.sort(Comparator.comparing(Node::getLabel, Comparator.nullsLast(Comparator.naturalOrder())));
            return sorted;
        }
        return leaves;
    }
}
