package com.timetree.model;

/**
 * Base class of every failure raised by the tree model, parser, mutators and layout.
 * A failed call never leaves a tree half-modified.
 */
public abstract class TimeTreeException extends RuntimeException {

    public enum ErrorKind {
        MALFORMED_DESCRIPTION,
        INVALID_AGE,
        INVALID_SCALE,
        ROOT_REMOVAL,
        INCONSISTENT_TREE,
        EMPTY_TREE
    }

    private final ErrorKind kind;

    protected TimeTreeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Tree text that violates the bracket or token grammar.
     */
    public static class MalformedDescription extends TimeTreeException {
        private final int position;

        public MalformedDescription(String message, int position) {
            super(ErrorKind.MALFORMED_DESCRIPTION, position >= 0 ? message + " at position " + position : message);
            this.position = position;
        }

        public MalformedDescription(String message) {
            this(message, -1);
        }

        /** Character offset of the offending token, or -1 when unknown. */
        public int getPosition() {
            return position;
        }
    }

    /**
     * A node would end up older than its parent, or with an unusable age.
     */
    public static class InvalidAge extends TimeTreeException {
        public InvalidAge(String message) {
            super(ErrorKind.INVALID_AGE, message);
        }
    }

    public static class InvalidScale extends TimeTreeException {
        public InvalidScale(String message) {
            super(ErrorKind.INVALID_SCALE, message);
        }
    }

    public static class RootRemoval extends TimeTreeException {
        public RootRemoval(String message) {
            super(ErrorKind.ROOT_REMOVAL, message);
        }
    }

    public static class InconsistentTree extends TimeTreeException {
        public InconsistentTree(String message) {
            super(ErrorKind.INCONSISTENT_TREE, message);
        }
    }

    public static class EmptyTree extends TimeTreeException {
        public EmptyTree(String message) {
            super(ErrorKind.EMPTY_TREE, message);
        }
    }
}
