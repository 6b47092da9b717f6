package com.jmath.exceptions;

/**
 * Base class of every failure raised while building, inspecting or evaluating expression trees.
 */
public class MathAstException extends RuntimeException {
    public MathAstException(String message) {
        super(message);
    }

    public MathAstException(String message, Throwable cause) {
        super(message, cause);
    }
}
