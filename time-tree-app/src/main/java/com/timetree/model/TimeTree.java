package com.timetree.model;

import com.timetree.model.TimeTreeException.InconsistentTree;
import com.timetree.model.TimeTreeException.InvalidAge;
import com.timetree.model.TimeTreeException.InvalidScale;
import com.timetree.model.TimeTreeException.RootRemoval;

import java.util.*;
import java.util.function.Predicate;

/**
 * A rooted tree whose nodes carry ages (time before the present, growing toward the root).
 *
 * Nodes live in an arena keyed by their integer id; ids are handed out in creation order and
 * never reused inside one tree. Every non-root node is at most as old as its parent.
 *
 * Mutating methods either complete with all invariants holding or throw before anything
 * observable has changed. Instances are not thread-safe.
 */
public final class TimeTree {

    private final Map<Integer, Node> nodes = new HashMap<>();
    private Node root;
    private int nextId;
    private Double origin;

    private TimeTree() {
    }

    public static TimeTree createRoot(double age, String label) {
        requireUsableAge(age);
        TimeTree tree = new TimeTree();
        tree.root = tree.newNode(age, label);
        return tree;
    }

    public Node root() {
        return root;
    }

    public int size() {
        return nodes.size();
    }

    // ========== CONSTRUCTION ==========

    public Node addChild(Node parent, double age, String label) {
        requireMember(parent);
        requireUsableAge(age);
        if (age > parent.getAge()) {
            throw new InvalidAge(String.format(
                    "Child age %s exceeds parent age %s (parent %s)", age, parent.getAge(), describe(parent)));
        }
        Node child = newNode(age, label);
        child.setParentId(parent.getId());
        parent.childList().add(child);
        return child;
    }

    public void annotate(Node node, String key, String value) {
        requireMember(node);
        Objects.requireNonNull(key, "key");
        node.annotationMap().put(key, value);
    }

    /**
     * Age of the start of the root's stem branch, when the tree text gave the root a length.
     */
    public OptionalDouble origin() {
        return origin == null ? OptionalDouble.empty() : OptionalDouble.of(origin);
    }

    public void setOrigin(double origin) {
        requireUsableAge(origin);
        if (origin < root.getAge()) {
            throw new InvalidAge(String.format("Origin %s is younger than root age %s", origin, root.getAge()));
        }
        this.origin = origin;
    }

    public void clearOrigin() {
        this.origin = null;
    }

    /**
     * Detaches {@code node} and everything below it. The detached nodes are no longer part of this tree.
     */
    public void removeSubtree(Node node) {
        detach(node);
    }

    // ========== QUERIES ==========

    public boolean isLeaf(Node node) {
        requireMember(node);
        return node.isLeaf();
    }

    public Optional<Node> parent(Node node) {
        requireMember(node);
        Integer parentId = node.parentId();
        return parentId == null ? Optional.empty() : Optional.of(nodes.get(parentId));
    }

    /**
     * Parent age minus node age; zero for the root unless an origin is set.
     */
    public double branchLength(Node node) {
        return parent(node)
                .map(p -> p.getAge() - node.getAge())
                .orElseGet(() -> origin == null ? 0.0 : origin - node.getAge());
    }

    /**
     * Ancestors of {@code node}, nearest first, ending with the root. Empty for the root.
     */
    public List<Node> ancestors(Node node) {
        requireMember(node);
        List<Node> result = new ArrayList<>();
        Integer parentId = node.parentId();
        while (parentId != null) {
            Node parent = nodes.get(parentId);
            result.add(parent);
            parentId = parent.parentId();
        }
        return result;
    }

    /**
     * Depth-first pre-order walk starting with {@code node} itself. Each call to
     * {@code iterator()} starts a fresh walk.
     */
    public Iterable<Node> descendants(Node node) {
        requireMember(node);
        return () -> new PreOrderIterator(node, n -> true);
    }

    public Iterable<Node> leaves(Node node) {
        requireMember(node);
        return () -> new PreOrderIterator(node, Node::isLeaf);
    }

    public Iterable<Node> nodes() {
        return descendants(root);
    }

    public List<Node> leaves() {
        List<Node> result = new ArrayList<>();
        leaves(root).forEach(result::add);
        return result;
    }

    public int leafCount() {
        int count = 0;
        for (Node ignored : leaves(root)) {
            count++;
        }
        return count;
    }

    public Optional<Node> findById(int id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * First node in pre-order carrying {@code label}.
     */
    public Optional<Node> findByLabel(String label) {
        for (Node node : nodes()) {
            if (Objects.equals(node.getLabel(), label)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public double maxAge() {
        double max = root.getAge();
        for (Node node : nodes()) {
            max = Math.max(max, node.getAge());
        }
        return max;
    }

    public boolean isUltrametric(double tolerance) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Node leaf : leaves(root)) {
            min = Math.min(min, leaf.getAge());
            max = Math.max(max, leaf.getAge());
        }
        return max - min <= tolerance;
    }

    // ========== VALIDATION ==========

    /**
     * Checks age monotonicity, parent/child consistency and that the arena holds exactly
     * the nodes reachable from the root.
     *
     * @return true when every invariant holds
     * @throws InconsistentTree naming the first violation found
     */
    public boolean validate() {
        if (root == null) {
            throw new InconsistentTree("Tree has no root");
        }
        if (root.parentId() != null) {
            throw new InconsistentTree("Root " + describe(root) + " has a parent");
        }
        if (origin != null && origin < root.getAge()) {
            throw new InconsistentTree("Origin " + origin + " is younger than the root");
        }

        Set<Integer> seen = new HashSet<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (!seen.add(node.getId())) {
                throw new InconsistentTree("Node " + describe(node) + " is reachable more than once");
            }
            if (nodes.get(node.getId()) != node) {
                throw new InconsistentTree("Node " + describe(node) + " is not registered in this tree");
            }
            if (!Double.isFinite(node.getAge())) {
                throw new InconsistentTree("Node " + describe(node) + " has non-finite age");
            }
            for (Node child : node.childList()) {
                if (!Objects.equals(child.parentId(), node.getId())) {
                    throw new InconsistentTree("Node " + describe(child) + " does not point back to parent " + describe(node));
                }
                if (child.getAge() > node.getAge()) {
                    throw new InconsistentTree(String.format(
                            "Node %s (age %s) is older than its parent %s (age %s)",
                            describe(child), child.getAge(), describe(node), node.getAge()));
                }
                stack.push(child);
            }
        }
        if (seen.size() != nodes.size()) {
            throw new InconsistentTree((nodes.size() - seen.size()) + " registered nodes are unreachable from the root");
        }
        return true;
    }

    // ========== MUTATION ==========

    /**
     * Detaches the subtree below {@code node} and returns it as a standalone tree rooted at
     * {@code node}. Node objects and ids are carried over unchanged.
     */
    public TimeTree prune(Node node) {
        List<Node> subtree = detach(node);
        TimeTree pruned = new TimeTree();
        pruned.nextId = nextId;
        pruned.root = node;
        for (Node n : subtree) {
            pruned.nodes.put(n.getId(), n);
        }
        validate();
        pruned.validate();
        return pruned;
    }

    /**
     * Makes {@code newRoot} the root by reversing every edge on the path from the current root.
     * Ages are kept, so each reversed edge must join nodes of equal age; otherwise the tree is
     * left untouched and {@link InconsistentTree} is thrown. The origin is dropped.
     */
    public TimeTree reroot(Node newRoot) {
        requireMember(newRoot);
        if (newRoot == root) {
            return this;
        }

        // path[0] = newRoot ... path[last] = current root
        List<Node> path = new ArrayList<>();
        path.add(newRoot);
        path.addAll(ancestors(newRoot));
        for (int i = 0; i + 1 < path.size(); i++) {
            Node formerChild = path.get(i);
            Node formerParent = path.get(i + 1);
            if (formerParent.getAge() > formerChild.getAge()) {
                throw new InconsistentTree(String.format(
                        "Rerooting at %s would place %s (age %s) below %s (age %s)",
                        describe(newRoot), describe(formerParent), formerParent.getAge(),
                        describe(formerChild), formerChild.getAge()));
            }
        }

        for (int i = path.size() - 1; i > 0; i--) {
            Node formerParent = path.get(i);
            Node formerChild = path.get(i - 1);
            formerParent.childList().remove(formerChild);
            formerChild.childList().add(formerParent);
            formerParent.setParentId(formerChild.getId());
        }
        newRoot.setParentId(null);
        root = newRoot;
        origin = null;
        validate();
        return this;
    }

    /**
     * Multiplies every age, and the origin, by {@code factor}.
     */
    public void rescale(double factor) {
        if (!Double.isFinite(factor) || factor <= 0) {
            throw new InvalidScale("Scale factor must be a finite positive number, got " + factor);
        }
        Map<Node, Double> scaled = new HashMap<>();
        for (Node node : nodes()) {
            double age = node.getAge() * factor;
            if (!Double.isFinite(age)) {
                throw new InvalidScale("Scale factor " + factor + " overflows age of " + describe(node));
            }
            scaled.put(node, age);
        }
        Double scaledOrigin = origin == null ? null : origin * factor;
        if (scaledOrigin != null && !Double.isFinite(scaledOrigin)) {
            throw new InvalidScale("Scale factor " + factor + " overflows the origin");
        }
        apply(scaled, scaledOrigin);
    }

    /**
     * Adds {@code offset} (either sign) to every age and to the origin.
     */
    public void shift(double offset) {
        if (!Double.isFinite(offset)) {
            throw new InvalidAge("Age offset must be finite, got " + offset);
        }
        Map<Node, Double> shifted = new HashMap<>();
        for (Node node : nodes()) {
            double age = node.getAge() + offset;
            if (age < 0 || !Double.isFinite(age)) {
                throw new InvalidAge(String.format(
                        "Shifting by %s gives %s age %s", offset, describe(node), age));
            }
            shifted.put(node, age);
        }
        apply(shifted, origin == null ? null : origin + offset);
    }

    /**
     * Orders every node's children by the size of their clades. The sort is stable.
     */
    public void ladderize(boolean increasing) {
        Map<Node, Integer> cladeSizes = new HashMap<>();
        List<Node> preOrder = new ArrayList<>();
        nodes().forEach(preOrder::add);
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            Node node = preOrder.get(i);
            int size = 1;
            for (Node child : node.childList()) {
                size += cladeSizes.get(child);
            }
            cladeSizes.put(node, size);
        }

        Comparator<Node> bySize = Comparator.comparing(node -> cladeSizes.get(node));
        if (!increasing) {
            bySize = bySize.reversed();
        }
        for (Node node : preOrder) {
            node.childList().sort(bySize);
        }
        validate();
    }

    /**
     * Deep copy with the same ids, ages, labels, annotations, child order and origin.
     */
    public TimeTree copy() {
        TimeTree copy = new TimeTree();
        copy.nextId = nextId;
        copy.origin = origin;
        Map<Integer, Node> copies = new HashMap<>();
        for (Node node : nodes()) {
            Node c = new Node(node.getId(), node.getAge(), node.getLabel());
            c.annotationMap().putAll(node.annotationMap());
            c.setParentId(node.parentId());
            copies.put(c.getId(), c);
            copy.nodes.put(c.getId(), c);
            if (node.parentId() == null) {
                copy.root = c;
            } else {
                copies.get(node.parentId()).childList().add(c);
            }
        }
        return copy;
    }

    // ========== HELPERS ==========

    private Node newNode(double age, String label) {
        Node node = new Node(nextId++, age, label);
        nodes.put(node.getId(), node);
        return node;
    }

    private List<Node> detach(Node node) {
        requireMember(node);
        if (node == root) {
            throw new RootRemoval("Cannot remove the root " + describe(node));
        }
        List<Node> subtree = new ArrayList<>();
        descendants(node).forEach(subtree::add);

        Node parent = nodes.get(node.parentId());
        parent.childList().remove(node);
        node.setParentId(null);
        for (Node n : subtree) {
            nodes.remove(n.getId());
        }
        return subtree;
    }

    private void apply(Map<Node, Double> ages, Double newOrigin) {
        ages.forEach(Node::setAge);
        origin = newOrigin;
        validate();
    }

    private void requireMember(Node node) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        if (nodes.get(node.getId()) != node) {
            throw new IllegalArgumentException("Node " + describe(node) + " does not belong to this tree");
        }
    }

    private static void requireUsableAge(double age) {
        if (!Double.isFinite(age) || age < 0) {
            throw new InvalidAge("Age must be a finite non-negative number, got " + age);
        }
    }

    private static String describe(Node node) {
        return node.hasLabel() ? "'" + node.getLabel() + "' (#" + node.getId() + ")" : "#" + node.getId();
    }

    @Override
    public String toString() {
        return "Time tree with " + size() + " nodes (including " + leafCount() + " leaves)";
    }

    private static final class PreOrderIterator implements Iterator<Node> {
        private final Deque<Node> stack = new ArrayDeque<>();
        private final Predicate<Node> filter;
        private Node next;

        PreOrderIterator(Node start, Predicate<Node> filter) {
            this.filter = filter;
            stack.push(start);
            advance();
        }

        private void advance() {
            next = null;
            while (!stack.isEmpty()) {
                Node node = stack.pop();
                List<Node> children = node.childList();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
                if (filter.test(node)) {
                    next = node;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Node next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            Node current = next;
            advance();
            return current;
        }
    }
}
