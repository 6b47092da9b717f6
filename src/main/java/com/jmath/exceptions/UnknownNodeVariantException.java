package com.jmath.exceptions;

public class UnknownNodeVariantException extends MathAstException {
    private final String variant;

    public UnknownNodeVariantException(String visitor, String variant) {
        super(visitor + " has no case for " + variant);
        this.variant = variant;
    }

    public String getVariant() {
        return variant;
    }
}
