package com.jmath.exceptions;

/**
 * Thrown when a builder is frozen while a required child slot is unset, or while a slot
 * that must stay empty for its operator is filled.
 */
public class IncompleteNodeException extends MathAstException {
    public IncompleteNodeException(String message) {
        super(message);
    }
}
