package com.jmath.interpreting;

import com.jmath.nodes.DepthLimit;
import com.jmath.nodes.Node;
import com.jmath.nodes.NodeKind;
import com.jmath.nodes.NodeVisitor;
import com.jmath.nodes.Operators;

/**
 * Prints a tree as plain infix text, e.g. {@code sin(x) + (y - 1)^2}.
 *
 * <p>Operands that are themselves operator expressions are always parenthesized, so the
 * output never depends on a precedence table.
 */
public class InfixPrinter implements NodeVisitor<String> {
    private final DepthLimit depthLimit;

    public InfixPrinter() {
        this(DepthLimit.DEFAULT_MAX_DEPTH);
    }

    public InfixPrinter(int maxDepth) {
        this.depthLimit = new DepthLimit(maxDepth);
    }

    public String format(Node node) {
        depthLimit.enter();
        try {
            return node.accept(this);
        } finally {
            depthLimit.exit();
        }
    }

    @Override
    public String visitInteger(Node.IntegerNode node) {
        return Long.toString(node.value());
    }

    @Override
    public String visitNumber(Node.NumberNode node) {
        return Double.toString(node.value());
    }

    @Override
    public String visitRational(Node.RationalNode node) {
        return node.numerator() + "/" + node.denominator();
    }

    @Override
    public String visitVariable(Node.VariableNode node) {
        return node.name();
    }

    @Override
    public String visitConstant(Node.ConstantNode node) {
        return node.name();
    }

    @Override
    public String visitFunction(Node.FunctionNode node) {
        return node.name() + "(" + format(node.operand()) + ")";
    }

    @Override
    public String visitSubExpression(Node.SubExpressionNode node) {
        return "(" + format(node.inner()) + ")";
    }

    @Override
    public String visitExpression(Node.ExpressionNode node) {
        String operator = node.operator();
        if (node.isUnary()) {
            return switch (operator) {
                case Operators.FACTORIAL -> operand(node.left()) + operator;
                case Operators.SQUARE_ROOT -> operator + "(" + format(node.left()) + ")";
                default -> operator + operand(node.left());
            };
        }
        return operand(node.left()) + " " + operator + " " + operand(node.right());
    }

    private String operand(Node node) {
        String text = format(node);
        return node.kind() == NodeKind.EXPRESSION ? "(" + text + ")" : text;
    }
}
