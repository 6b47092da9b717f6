package com.jmath.exceptions;

public class NumericOverflowException extends MathAstException {
    public NumericOverflowException(String message) {
        super(message);
    }
}
