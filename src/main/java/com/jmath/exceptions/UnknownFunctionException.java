package com.jmath.exceptions;

public class UnknownFunctionException extends MathAstException {
    private final String name;

    public UnknownFunctionException(String name) {
        super("Unknown function: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
