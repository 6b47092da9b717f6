package com.jmath.nodes;

import com.jmath.exceptions.UnknownNodeVariantException;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NodeVisitorTest {

    /**
     * Counts nodes by recursing through accept, recording every node it is handed.
     */
    private static final class CountingVisitor implements NodeVisitor<Integer> {
        final Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        int dispatches;

        private int leaf(Node node) {
            dispatches++;
            seen.add(node);
            return 1;
        }

        @Override
        public Integer visitInteger(Node.IntegerNode node) {
            return leaf(node);
        }

        @Override
        public Integer visitNumber(Node.NumberNode node) {
            return leaf(node);
        }

        @Override
        public Integer visitRational(Node.RationalNode node) {
            return leaf(node);
        }

        @Override
        public Integer visitVariable(Node.VariableNode node) {
            return leaf(node);
        }

        @Override
        public Integer visitConstant(Node.ConstantNode node) {
            return leaf(node);
        }

        @Override
        public Integer visitFunction(Node.FunctionNode node) {
            return leaf(node) + node.operand().accept(this);
        }

        @Override
        public Integer visitSubExpression(Node.SubExpressionNode node) {
            return leaf(node) + node.inner().accept(this);
        }

        @Override
        public Integer visitExpression(Node.ExpressionNode node) {
            int count = leaf(node) + node.left().accept(this);
            return node.isUnary() ? count : count + node.right().accept(this);
        }
    }

    private static final class KindVisitor implements NodeVisitor<NodeKind> {
        @Override
        public NodeKind visitInteger(Node.IntegerNode node) {
            return NodeKind.INTEGER;
        }

        @Override
        public NodeKind visitNumber(Node.NumberNode node) {
            return NodeKind.NUMBER;
        }

        @Override
        public NodeKind visitRational(Node.RationalNode node) {
            return NodeKind.RATIONAL;
        }

        @Override
        public NodeKind visitVariable(Node.VariableNode node) {
            return NodeKind.VARIABLE;
        }

        @Override
        public NodeKind visitConstant(Node.ConstantNode node) {
            return NodeKind.CONSTANT;
        }

        @Override
        public NodeKind visitFunction(Node.FunctionNode node) {
            return NodeKind.FUNCTION;
        }

        @Override
        public NodeKind visitSubExpression(Node.SubExpressionNode node) {
            return NodeKind.SUB_EXPRESSION;
        }

        @Override
        public NodeKind visitExpression(Node.ExpressionNode node) {
            return NodeKind.EXPRESSION;
        }
    }

    /** sin(x) + 1 / 2.5  *  (y ^ 1/2 - pi): 13 nodes, every variant present. */
    private static Node sampleTree() {
        Node left = new Node.ExpressionNode(
            new Node.FunctionNode("sin", new Node.VariableNode("x")),
            "+",
            new Node.ExpressionNode(new Node.IntegerNode(1), "/", new Node.NumberNode(2.5)));
        Node right = new Node.SubExpressionNode(
            new Node.ExpressionNode(
                new Node.ExpressionNode(new Node.VariableNode("y"), "^", new Node.RationalNode(1, 2)),
                "-",
                new Node.ConstantNode("pi")));
        return new Node.ExpressionNode(left, "*", right);
    }

    private static int countByChildren(Node root) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        int count = 0;
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            count++;
            node.children().each(pending::push);
        }
        return count;
    }

    @Test
    public void testTraversalDispatchesOncePerNode() {
        Node tree = sampleTree();
        CountingVisitor visitor = new CountingVisitor();

        int result = tree.accept(visitor);

        assertEquals(13, countByChildren(tree));
        assertEquals(13, result);
        assertEquals(13, visitor.dispatches);
        assertEquals(13, visitor.seen.size());
    }

    @Test
    public void testAcceptPicksTheVariantCase() {
        KindVisitor visitor = new KindVisitor();
        Node x = new Node.VariableNode("x");
        Node[] nodes = {
            new Node.IntegerNode(1),
            new Node.NumberNode(1.5),
            new Node.RationalNode(1, 2),
            x,
            new Node.ConstantNode("e"),
            new Node.FunctionNode("exp", x),
            new Node.SubExpressionNode(x),
            new Node.ExpressionNode(x, "!", null)
        };
        for (Node node : nodes) {
            assertEquals(node.kind(), node.accept(visitor));
        }
    }

    @Test
    public void testPartialVisitorReportsMissingCase() {
        NodeVisitor<Long> integersOnly = new AbstractNodeVisitor<>() {
            @Override
            public Long visitInteger(Node.IntegerNode node) {
                return node.value();
            }
        };

        assertEquals(7L, new Node.IntegerNode(7).accept(integersOnly));

        UnknownNodeVariantException e = assertThrows(UnknownNodeVariantException.class,
            () -> new Node.VariableNode("x").accept(integersOnly));
        assertEquals("variable", e.getVariant());
    }
}
