package com.timetree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a {@link TimeTree}.
 *
 * Children are owned by the node. The parent is only known by id and is
 * resolved through the owning tree, see {@link TimeTree#parent(Node)}.
 * All mutation goes through the tree so the age invariant can be checked.
 */
public final class Node {

    private final int id;
    private double age;
    private final String label;
    private final Map<String, String> annotations = new LinkedHashMap<>();
    private Integer parentId;
    private final List<Node> children = new ArrayList<>();

    Node(int id, double age, String label) {
        this.id = id;
        this.age = age;
        this.label = (label == null || label.isEmpty()) ? null : label;
    }

    public int getId() { return id; }
    public double getAge() { return age; }
    public String getLabel() { return label; }
    public Map<String, String> getAnnotations() { return Collections.unmodifiableMap(annotations); }
    public List<Node> getChildren() { return Collections.unmodifiableList(children); }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean hasLabel() {
        return label != null;
    }

    Integer parentId() { return parentId; }
    List<Node> childList() { return children; }
    Map<String, String> annotationMap() { return annotations; }

    void setAge(double age) { this.age = age; }
    void setParentId(Integer parentId) { this.parentId = parentId; }

    @Override
    public String toString() {
        return "Node{id=" + id + ", label=" + label + ", age=" + age + "}";
    }
}
