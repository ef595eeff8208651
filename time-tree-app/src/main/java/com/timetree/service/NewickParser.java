package com.timetree.service;

import com.timetree.config.TimeTreeConfig;
import com.timetree.model.Node;
import com.timetree.model.TimeTree;
import com.timetree.model.TimeTreeException.InvalidAge;
import com.timetree.model.TimeTreeException.MalformedDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Parses bracketed (Newick) tree descriptions into {@link TimeTree}s.
 *
 * <pre>
 * tree       := node [';']
 * node       := ['(' node (',' node)* ')'] [label] [annotation] [':' length]
 * annotation := '[&amp;' key '=' value (',' key '=' value)* ']'
 * </pre>
 *
 * Lengths are unsigned decimals, optionally in scientific notation ({@code 1.5e-3}). Inside a
 * quoted label or value a doubled quote character stands for one literal quote.
 * A child written without a length gets the configured default branch length; a length on
 * the outermost node sets the tree's origin. Ages are assigned top-down:
 * {@code child.age = parent.age - length}.
 */
@Service
public class NewickParser {

    private static final Logger log = LoggerFactory.getLogger(NewickParser.class);

    private static final Pattern LENGTH = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final TimeTreeConfig config;

    public NewickParser(TimeTreeConfig config) {
        this.config = config;
    }

    public TimeTree parse(String text) {
        return parse(text, 0.0);
    }

    /**
     * @param rootAge age given to the outermost node
     * @throws MalformedDescription when the text does not follow the grammar
     * @throws InvalidAge when a branch is longer than the age left above it
     */
    public TimeTree parse(String text, double rootAge) {
        ParsedNode parsed = parseStructure(text);
        TimeTree tree = build(parsed, rootAge);
        log.debug("Parsed tree with {} nodes ({} leaves), root age {}", tree.size(), tree.leafCount(), rootAge);
        return tree;
    }

    /**
     * Parses with the root age chosen so the youngest node sits at age 0.
     */
    public TimeTree parseLeafAligned(String text) {
        ParsedNode parsed = parseStructure(text);
        double rootAge = 0.0 - youngestAge(parsed, 0.0);
        // Subtracting edge by edge can land a hair below zero; nudge the root up until it does not
        for (double youngest = youngestAge(parsed, rootAge); youngest < 0; youngest = youngestAge(parsed, rootAge)) {
            rootAge = Math.nextUp(rootAge - youngest);
        }
        TimeTree tree = build(parsed, rootAge);
        log.debug("Parsed leaf-aligned tree with {} nodes, root age {}", tree.size(), rootAge);
        return tree;
    }

    /**
     * Smallest age any node would get below a root of the given age, using the same
     * edge-by-edge subtraction as {@link #build}.
     */
    private double youngestAge(ParsedNode parsedRoot, double rootAge) {
        double youngest = rootAge;
        Deque<ParsedNode> nodes = new ArrayDeque<>();
        Deque<Double> parentAges = new ArrayDeque<>();
        for (ParsedNode child : parsedRoot.children) {
            nodes.push(child);
            parentAges.push(rootAge);
        }
        while (!nodes.isEmpty()) {
            ParsedNode node = nodes.pop();
            double age = parentAges.pop() - lengthOf(node);
            youngest = Math.min(youngest, age);
            for (ParsedNode child : node.children) {
                nodes.push(child);
                parentAges.push(age);
            }
        }
        return youngest;
    }

    // ========== STRUCTURE ==========

    private ParsedNode parseStructure(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedDescription("Tree description is empty");
        }
        Cursor cursor = new Cursor(tokenize(text), text.length());
        ParsedNode root = parseNode(cursor);
        cursor.accept(TokenType.SEMICOLON);
        if (!cursor.atEnd()) {
            Token extra = cursor.peek();
            throw new MalformedDescription("Unexpected '" + extra.text + "' after end of tree", extra.position);
        }
        return root;
    }

    /**
     * Reads one node and everything nested in it. Groups still waiting for their ')' are kept on
     * an explicit stack, so nesting depth is bounded only by memory.
     */
    private ParsedNode parseNode(Cursor cursor) {
        Deque<ParsedNode> openGroups = new ArrayDeque<>();
        while (true) {
            ParsedNode node = new ParsedNode(cursor.position());
            if (cursor.accept(TokenType.OPEN_PAREN)) {
                openGroups.push(node);
                continue;
            }
            parseSuffix(cursor, node);

            // Attach the finished node and close every group that ends right after it
            while (true) {
                if (openGroups.isEmpty()) {
                    return node;
                }
                ParsedNode group = openGroups.peek();
                group.children.add(node);
                if (cursor.accept(TokenType.COMMA)) {
                    break;
                }
                cursor.expect(TokenType.CLOSE_PAREN, "')'");
                openGroups.pop();
                parseSuffix(cursor, group);
                node = group;
            }
        }
    }

    private void parseSuffix(Cursor cursor, ParsedNode node) {
        if (cursor.accept(TokenType.STRING)) {
            node.label = cursor.last().text;
        }

        if (cursor.accept(TokenType.OPEN_ANNOTATION)) {
            parseAnnotation(cursor, node);
            while (cursor.accept(TokenType.COMMA)) {
                parseAnnotation(cursor, node);
            }
            cursor.expect(TokenType.CLOSE_ANNOTATION, "']'");
        }

        if (cursor.accept(TokenType.COLON)) {
            Token token = cursor.expect(TokenType.STRING, "branch length");
            if (!LENGTH.matcher(token.text).matches()) {
                throw new MalformedDescription("Invalid branch length '" + token.text + "'", token.position);
            }
            double length = Double.parseDouble(token.text);
            if (!Double.isFinite(length)) {
                throw new MalformedDescription("Branch length '" + token.text + "' is out of range", token.position);
            }
            node.length = length;
        }
    }

    private void parseAnnotation(Cursor cursor, ParsedNode node) {
        String key = cursor.expect(TokenType.STRING, "annotation key").text;
        cursor.expect(TokenType.EQUALS, "'='");
        String value = cursor.expect(TokenType.STRING, "annotation value").text;
        node.annotations.put(key, value);
    }

    // ========== AGES ==========

    private TimeTree build(ParsedNode parsedRoot, double rootAge) {
        TimeTree tree = TimeTree.createRoot(rootAge, parsedRoot.label);
        Node root = tree.root();
        parsedRoot.annotations.forEach((k, v) -> tree.annotate(root, k, v));
        if (parsedRoot.length != null) {
            tree.setOrigin(rootAge + parsedRoot.length);
        }

        Deque<Pending> stack = new ArrayDeque<>();
        pushChildren(stack, parsedRoot, root);
        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            ParsedNode parsed = pending.parsed;
            double age = pending.parent.getAge() - lengthOf(parsed);
            if (age < 0) {
                throw new InvalidAge(String.format(
                        "Branch of length %s at position %d gives %s a negative age (%s)",
                        lengthOf(parsed), parsed.position, describe(parsed), age));
            }
            Node node = tree.addChild(pending.parent, age, parsed.label);
            parsed.annotations.forEach((k, v) -> tree.annotate(node, k, v));
            pushChildren(stack, parsed, node);
        }

        tree.validate();
        return tree;
    }

    private void pushChildren(Deque<Pending> stack, ParsedNode parsed, Node node) {
        for (int i = parsed.children.size() - 1; i >= 0; i--) {
            stack.push(new Pending(parsed.children.get(i), node));
        }
    }

    private double lengthOf(ParsedNode node) {
        return node.length != null ? node.length : config.getDefaultBranchLength();
    }

    private static String describe(ParsedNode node) {
        return node.label != null ? "'" + node.label + "'" : "an unlabeled node";
    }

    // ========== TOKENS ==========

    static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            switch (c) {
                case '(' -> tokens.add(new Token(TokenType.OPEN_PAREN, "(", i++));
                case ')' -> tokens.add(new Token(TokenType.CLOSE_PAREN, ")", i++));
                case ',' -> tokens.add(new Token(TokenType.COMMA, ",", i++));
                case ':' -> tokens.add(new Token(TokenType.COLON, ":", i++));
                case ';' -> tokens.add(new Token(TokenType.SEMICOLON, ";", i++));
                case '=' -> tokens.add(new Token(TokenType.EQUALS, "=", i++));
                case ']' -> tokens.add(new Token(TokenType.CLOSE_ANNOTATION, "]", i++));
                case '[' -> {
                    if (i + 1 >= text.length() || text.charAt(i + 1) != '&') {
                        throw new MalformedDescription("Expected '[&' to open an annotation", i);
                    }
                    tokens.add(new Token(TokenType.OPEN_ANNOTATION, "[&", i));
                    i += 2;
                }
                case '"', '\'' -> {
                    int start = i;
                    StringBuilder quoted = new StringBuilder();
                    i++;
                    while (true) {
                        if (i >= text.length()) {
                            throw new MalformedDescription("Unterminated quoted string", start);
                        }
                        char q = text.charAt(i);
                        if (q == c && i + 1 < text.length() && text.charAt(i + 1) == c) {
                            quoted.append(c);
                            i += 2;
                        } else if (q == c) {
                            i++;
                            break;
                        } else {
                            quoted.append(q);
                            i++;
                        }
                    }
                    tokens.add(new Token(TokenType.STRING, quoted.toString(), start));
                }
                default -> {
                    if (!isBareChar(c)) {
                        throw new MalformedDescription("Unrecognized character '" + c + "'", i);
                    }
                    int start = i;
                    while (i < text.length() && isBareChar(text.charAt(i))) {
                        i++;
                    }
                    tokens.add(new Token(TokenType.STRING, text.substring(start, i), start));
                }
            }
        }
        return tokens;
    }

    static boolean isBareChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '_' || c == '.' || c == '-' || c == '+';
    }

    enum TokenType {
        OPEN_PAREN, CLOSE_PAREN, COMMA, COLON, SEMICOLON, EQUALS, OPEN_ANNOTATION, CLOSE_ANNOTATION, STRING
    }

    record Token(TokenType type, String text, int position) {
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private final int endPosition;
        private int index;

        Cursor(List<Token> tokens, int endPosition) {
            this.tokens = tokens;
            this.endPosition = endPosition;
        }

        boolean atEnd() {
            return index >= tokens.size();
        }

        Token peek() {
            return tokens.get(index);
        }

        Token last() {
            return tokens.get(index - 1);
        }

        int position() {
            return atEnd() ? endPosition : peek().position;
        }

        boolean accept(TokenType type) {
            if (!atEnd() && peek().type == type) {
                index++;
                return true;
            }
            return false;
        }

        Token expect(TokenType type, String what) {
            if (atEnd()) {
                throw new MalformedDescription("Expected " + what + " but reached end of input", endPosition);
            }
            if (!accept(type)) {
                Token found = peek();
                throw new MalformedDescription("Expected " + what + " but found '" + found.text + "'", found.position);
            }
            return last();
        }
    }

    private static final class ParsedNode {
        final int position;
        final List<ParsedNode> children = new ArrayList<>();
        final Map<String, String> annotations = new LinkedHashMap<>();
        String label;
        Double length;

        ParsedNode(int position) {
            this.position = position;
        }
    }

    private record Pending(ParsedNode parsed, Node parent) {
    }
}
