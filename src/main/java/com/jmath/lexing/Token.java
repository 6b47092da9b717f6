package com.jmath.lexing;

/**
 * A lexical unit handed over by the tokenizer: its type tag and the matched text.
 */
public record Token(TokenType type, String value) {
    public Token {
        if (type == null) {
            throw new IllegalArgumentException("Token type is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("Token value is required");
        }
    }

    @Override
    public String toString() {
        return type + "(" + value + ")";
    }
}
