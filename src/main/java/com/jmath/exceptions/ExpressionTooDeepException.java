package com.jmath.exceptions;

public class ExpressionTooDeepException extends MathAstException {
    private final int maxDepth;

    public ExpressionTooDeepException(int maxDepth) {
        super("Expression nesting exceeds " + maxDepth + " levels");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
