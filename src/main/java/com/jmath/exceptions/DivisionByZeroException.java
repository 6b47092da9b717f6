package com.jmath.exceptions;

public class DivisionByZeroException extends MathAstException {
    public DivisionByZeroException(String message) {
        super(message);
    }
}
