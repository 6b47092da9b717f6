package com.jmath.exceptions;

public class UndefinedVariableException extends MathAstException {
    private final String name;

    public UndefinedVariableException(String name) {
        super("Undefined variable: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
