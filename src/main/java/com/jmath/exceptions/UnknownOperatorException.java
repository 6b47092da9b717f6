package com.jmath.exceptions;

public class UnknownOperatorException extends MathAstException {
    private final String operator;

    public UnknownOperatorException(String operator) {
        super("Unknown operator: " + operator);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
