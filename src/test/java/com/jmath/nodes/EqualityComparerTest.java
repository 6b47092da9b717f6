package com.jmath.nodes;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class EqualityComparerTest {

    private static final Node X = new Node.VariableNode("x");
    private static final Node Y = new Node.VariableNode("y");

    static Stream<Node> trees() {
        return Stream.of(
            new Node.IntegerNode(1),
            new Node.NumberNode(Double.NaN),
            new Node.RationalNode(2, 3),
            X,
            new Node.ConstantNode("pi"),
            new Node.FunctionNode("sin", X),
            new Node.SubExpressionNode(new Node.ExpressionNode(X, "+", Y)),
            new Node.ExpressionNode(new Node.ExpressionNode(X, "^", new Node.IntegerNode(2)), "-", null)
        );
    }

    @ParameterizedTest
    @MethodSource("trees")
    public void testReflexive(Node tree) {
        assertTrue(tree.compareTo(tree));
        assertTrue(EqualityComparer.compare(tree, tree));
    }

    @Test
    public void testSeparatelyBuiltTreesAreEqual() {
        Node a = new Node.ExpressionNode(new Node.FunctionNode("cos", new Node.VariableNode("t")), "*", new Node.NumberNode(0.5));
        Node b = new Node.ExpressionNode(new Node.FunctionNode("cos", new Node.VariableNode("t")), "*", new Node.NumberNode(0.5));

        assertNotSame(a, b);
        assertTrue(a.compareTo(b));
        assertTrue(b.compareTo(a));
    }

    static Stream<Arguments> differentTrees() {
        Node one = new Node.IntegerNode(1);
        return Stream.of(
            Arguments.of(new Node.IntegerNode(2), new Node.NumberNode(2.0)),
            Arguments.of(new Node.IntegerNode(2), new Node.IntegerNode(3)),
            Arguments.of(new Node.NumberNode(0.1), new Node.NumberNode(0.2)),
            Arguments.of(new Node.NumberNode(Double.NaN), new Node.NumberNode(1.0)),
            Arguments.of(new Node.NumberNode(Double.POSITIVE_INFINITY), new Node.NumberNode(Double.NEGATIVE_INFINITY)),
            Arguments.of(new Node.RationalNode(1, 2), new Node.RationalNode(1, 3)),
            Arguments.of(X, Y),
            Arguments.of(X, new Node.ConstantNode("x")),
            Arguments.of(new Node.FunctionNode("sin", X), new Node.FunctionNode("cos", X)),
            Arguments.of(new Node.FunctionNode("sin", X), new Node.FunctionNode("sin", Y)),
            Arguments.of(new Node.SubExpressionNode(X), X),
            Arguments.of(new Node.ExpressionNode(one, "+", X), new Node.ExpressionNode(one, "*", X)),
            Arguments.of(new Node.ExpressionNode(one, "+", X), new Node.ExpressionNode(X, "+", one)),
            Arguments.of(new Node.ExpressionNode(X, "-", null), new Node.ExpressionNode(X, "-", one))
        );
    }

    @ParameterizedTest
    @MethodSource("differentTrees")
    public void testDifferentTreesAreNotEqual(Node a, Node b) {
        assertFalse(a.compareTo(b));
        assertFalse(b.compareTo(a));
    }

    @Test
    public void testSignedZerosAreEqual() {
        assertTrue(new Node.NumberNode(0.0).compareTo(new Node.NumberNode(-0.0)));
        assertTrue(new Node.ExpressionNode(X, "*", new Node.NumberNode(-0.0))
            .compareTo(new Node.ExpressionNode(X, "*", new Node.NumberNode(0.0))));
    }

    @Test
    public void testRationalsCompareByValue() {
        assertTrue(new Node.RationalNode(2, 4).compareTo(new Node.RationalNode(1, 2)));
        assertTrue(new Node.RationalNode(-1, 2).compareTo(new Node.RationalNode(1, -2)));
    }

    @Test
    public void testAbsentCounterpart() {
        assertFalse(X.compareTo(null));
        assertFalse(EqualityComparer.compare(X, null));
        assertFalse(EqualityComparer.compare(null, X));
        assertTrue(EqualityComparer.compare(null, null));
    }

    @Test
    public void testDeepTrees() {
        Node a = X;
        Node b = X;
        Node c = Y;
        for (int i = 0; i < 100_000; i++) {
            a = new Node.ExpressionNode(a, "-", null);
            b = new Node.ExpressionNode(b, "-", null);
            c = new Node.ExpressionNode(c, "-", null);
        }
        assertTrue(a.compareTo(b));
        assertFalse(a.compareTo(c));
    }
}
