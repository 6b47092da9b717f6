package com.jmath.exceptions;

/**
 * Raised when an operator is applied to a value outside the set it is defined on.
 */
public class DomainException extends MathAstException {
    public DomainException(String message) {
        super(message);
    }
}
