package com.jmath.nodes;

import com.jmath.exceptions.IncompleteNodeException;
import com.jmath.exceptions.UnknownOperatorException;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Operator symbols carried by {@link Node.ExpressionNode} and the rules tying each symbol
 * to the child slots it uses.
 */
public final class Operators {
    public static final String PLUS = "+";
    public static final String MINUS = "-";
    public static final String TIMES = "*";
    public static final String DIVIDE = "/";
    public static final String POWER = "^";
    public static final String FACTORIAL = "!";
    public static final String SQUARE_ROOT = "sqrt";

    public static final ImmutableSet<String> KNOWN =
        Sets.immutable.of(PLUS, MINUS, TIMES, DIVIDE, POWER, FACTORIAL, SQUARE_ROOT);

    private Operators() {
    }

    /** Operators that only ever take the left slot. */
    public static boolean isUnaryOnly(String operator) {
        return FACTORIAL.equals(operator) || SQUARE_ROOT.equals(operator);
    }

    /** Whether the operator may leave its right slot empty. */
    public static boolean allowsMissingRight(String operator) {
        return MINUS.equals(operator) || isUnaryOnly(operator);
    }

    /**
     * Own weight of an expression node in the complexity score, children excluded.
     */
    static int complexityWeight(String operator) {
        return switch (operator) {
            case PLUS, MINUS, TIMES -> 2;
            case DIVIDE, FACTORIAL -> 4;
            case SQUARE_ROOT -> 5;
            case POWER -> 8;
            default -> throw new UnknownOperatorException(operator);
        };
    }

    static void checkArity(String operator, Node left, Node right) {
        if (operator == null || operator.isBlank()) {
            throw new IncompleteNodeException("Expression has no operator");
        }
        if (left == null) {
            throw new IncompleteNodeException("Expression '" + operator + "' has no left operand");
        }
        if (right == null && !allowsMissingRight(operator)) {
            throw new IncompleteNodeException("Expression '" + operator + "' has no right operand");
        }
        if (right != null && isUnaryOnly(operator)) {
            throw new IncompleteNodeException("Expression '" + operator + "' takes a single operand");
        }
    }
}
