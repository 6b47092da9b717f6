package com.jmath.exceptions;

public class UnknownConstantException extends MathAstException {
    private final String name;

    public UnknownConstantException(String name) {
        super("Unknown constant: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
