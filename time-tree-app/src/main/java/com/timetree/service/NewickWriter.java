package com.timetree.service;

import com.timetree.model.Node;
import com.timetree.model.TimeTree;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes a {@link TimeTree} back to Newick text that {@link NewickParser} reads into the same tree
 * when given the same root age.
 *
 * Labels and annotation values that need quoting are wrapped in single or double quotes; a quote
 * character inside a quoted string is written twice.
 */
@Service
public class NewickWriter {

    public String write(TimeTree tree) {
        StringBuilder newick = new StringBuilder();
        Map<Integer, Double> lengths = writtenLengths(tree);

        // Each frame remembers how many of its node's children have been written
        Deque<Frame> stack = new ArrayDeque<>();
        open(stack, tree.root(), newick);
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<Node> children = frame.node.getChildren();
            if (frame.next < children.size()) {
                if (frame.next > 0) {
                    newick.append(',');
                }
                open(stack, children.get(frame.next++), newick);
                continue;
            }
            stack.pop();
            if (!frame.node.isLeaf()) {
                newick.append(')');
            }
            appendLabel(frame.node, newick);
            if (!stack.isEmpty()) {
                newick.append(':').append(formatLength(lengths.get(frame.node.getId())));
            }
        }

        tree.origin().ifPresent(origin -> newick.append(':').append(formatLength(origin - tree.root().getAge())));
        return newick.append(';').toString();
    }

    /**
     * Branch lengths chosen against the ages {@link NewickParser} will rebuild from the text, so
     * subtracting them edge by edge never drives a node below age 0.
     */
    private static Map<Integer, Double> writtenLengths(TimeTree tree) {
        Map<Integer, Double> rebuiltAges = new HashMap<>();
        Map<Integer, Double> lengths = new HashMap<>();
        for (Node node : tree.nodes()) {
            Optional<Node> parent = tree.parent(node);
            if (parent.isEmpty()) {
                rebuiltAges.put(node.getId(), node.getAge());
                continue;
            }
            double parentAge = rebuiltAges.get(parent.get().getId());
            double length = Math.max(0.0, parentAge - node.getAge());
            while (parentAge - length < 0) {
                length = Math.nextDown(length);
            }
            lengths.put(node.getId(), length);
            rebuiltAges.put(node.getId(), parentAge - length);
        }
        return lengths;
    }

    private static void open(Deque<Frame> stack, Node node, StringBuilder newick) {
        if (!node.isLeaf()) {
            newick.append('(');
        }
        stack.push(new Frame(node));
    }

    private static void appendLabel(Node node, StringBuilder newick) {
        if (node.hasLabel()) {
            newick.append(quote(node.getLabel()));
        }

        if (!node.getAnnotations().isEmpty()) {
            newick.append("[&");
            boolean first = true;
            for (Map.Entry<String, String> entry : node.getAnnotations().entrySet()) {
                if (!first) {
                    newick.append(',');
                }
                first = false;
                newick.append(quote(entry.getKey())).append('=').append(quoteValue(entry.getValue()));
            }
            newick.append(']');
        }
    }

    static String formatLength(double length) {
        // Rounding can leave -0.0 or a tiny negative on zero-length branches
        return Double.toString(Math.max(0.0, length));
    }

    private static String quoteValue(String value) {
        String text = value == null ? "" : value;
        if (text.indexOf('"') < 0) {
            return wrap(text, '"');
        }
        return text.indexOf('\'') < 0 ? wrap(text, '\'') : wrap(text, '"');
    }

    static String quote(String text) {
        boolean bare = !text.isEmpty();
        for (int i = 0; i < text.length() && bare; i++) {
            bare = NewickParser.isBareChar(text.charAt(i));
        }
        if (bare) {
            return text;
        }
        if (text.indexOf('\'') >= 0 && text.indexOf('"') < 0) {
            return wrap(text, '"');
        }
        return wrap(text, '\'');
    }

    private static String wrap(String text, char quote) {
        String q = String.valueOf(quote);
        return q + text.replace(q, q + q) + q;
    }

    private static final class Frame {
        final Node node;
        int next;

        Frame(Node node) {
            this.node = node;
        }
    }
}
