package com.jmath.lexing;

public enum TokenType {
    POS_INT,
    INTEGER,
    REAL_NUMBER,
    IDENTIFIER,
    CONSTANT,
    FUNCTION_NAME,

    OPEN_PARENTHESIS,
    CLOSE_PARENTHESIS,

    ADDITION_OPERATOR,
    SUBTRACTION_OPERATOR,
    MULTIPLICATION_OPERATOR,
    DIVISION_OPERATOR,
    EXPONENTIATION_OPERATOR,
    FACTORIAL_OPERATOR,
    SQUARE_ROOT_OPERATOR,

    SEMICOLON,
    NEWLINE,
    WHITESPACE,
    TERMINATOR,
    SENTINEL
}
