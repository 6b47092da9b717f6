package com.jmath.interpreting;

import com.jmath.exceptions.ExpressionTooDeepException;
import com.jmath.nodes.Node;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InfixPrinterTest {

    private final InfixPrinter printer = new InfixPrinter();

    private static final Node X = new Node.VariableNode("x");
    private static final Node ONE = new Node.IntegerNode(1);

    private static Node binary(Node left, String operator, Node right) {
        return new Node.ExpressionNode(left, operator, right);
    }

    @Test
    public void testLeaves() {
        assertEquals("-3", printer.format(new Node.IntegerNode(-3)));
        assertEquals("2.5", printer.format(new Node.NumberNode(2.5)));
        assertEquals("1/2", printer.format(new Node.RationalNode(2, 4)));
        assertEquals("x", printer.format(X));
        assertEquals("pi", printer.format(new Node.ConstantNode("pi")));
    }

    @Test
    public void testFunctionAndGroup() {
        Node tree = binary(new Node.FunctionNode("sin", X), "+", ONE);
        assertEquals("sin(x) + 1", printer.format(tree));
        assertEquals("(sin(x) + 1)", printer.format(new Node.SubExpressionNode(tree)));
    }

    @Test
    public void testCompositeOperandsAreParenthesized() {
        Node sum = binary(ONE, "+", new Node.IntegerNode(2));
        assertEquals("(1 + 2) * x", printer.format(binary(sum, "*", X)));
        assertEquals("2 ^ (x / pi)",
            printer.format(binary(new Node.IntegerNode(2), "^", binary(X, "/", new Node.ConstantNode("pi")))));
    }

    @Test
    public void testUnaryOperators() {
        assertEquals("-x", printer.format(binary(X, "-", null)));
        assertEquals("-(x + 1)", printer.format(binary(binary(X, "+", ONE), "-", null)));
        assertEquals("5!", printer.format(binary(new Node.IntegerNode(5), "!", null)));
        assertEquals("(x - 1)!", printer.format(binary(binary(X, "-", ONE), "!", null)));
        assertEquals("sqrt(x + 1)", printer.format(binary(binary(X, "+", ONE), "sqrt", null)));
    }

    @Test
    public void testDepthLimit() {
        Node tree = X;
        for (int i = 0; i < 10; i++) {
            tree = binary(tree, "-", null);
        }
        Node deep = tree;
        assertThrows(ExpressionTooDeepException.class, () -> new InfixPrinter(5).format(deep));
        assertDoesNotThrow(() -> new InfixPrinter(11).format(deep));
        assertEquals("-(-x)", new InfixPrinter(3).format(binary(binary(X, "-", null), "-", null)));
    }
}
