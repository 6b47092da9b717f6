package com.jmath.nodes;

import com.jmath.exceptions.ExpressionTooDeepException;

/**
 * Nesting counter for recursive visitors. Not thread-safe; each traversal owns one.
 */
public final class DepthLimit {
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final int maxDepth;
    private int depth;

    public DepthLimit() {
        this(DEFAULT_MAX_DEPTH);
    }

    public DepthLimit(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum depth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Call before descending into a node; pair every successful call with {@link #exit()}.
     */
    public void enter() {
        if (depth >= maxDepth) {
            throw new ExpressionTooDeepException(maxDepth);
        }
        depth++;
    }

    public void exit() {
        depth--;
    }
}
