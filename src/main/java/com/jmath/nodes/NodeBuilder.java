package com.jmath.nodes;

/**
 * Mutable stand-in for a node whose children are not known yet. A parser creates one
 * per token through {@link NodeFactory}, fills the child slots as it reduces, and calls
 * {@link #build()} to freeze it into an immutable {@link Node}.
 *
 * <p>Builders are confined to the thread that parses.
 */
public sealed interface NodeBuilder {

    NodeKind kind();

    /**
     * @throws com.jmath.exceptions.IncompleteNodeException if a required child is missing
     *         or a child is set in a slot its operator does not use
     */
    Node build();

    /** Leaf tokens are complete as soon as they are read. */
    final class Leaf implements NodeBuilder {
        private final Node node;

        Leaf(Node node) {
            this.node = node;
        }

        @Override
        public NodeKind kind() {
            return node.kind();
        }

        @Override
        public Node build() {
            return node;
        }
    }

    final class FunctionBuilder implements NodeBuilder {
        private final String name;
        private Node operand;

        public FunctionBuilder(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        public FunctionBuilder operand(Node operand) {
            this.operand = operand;
            return this;
        }

        public boolean hasOperand() {
            return operand != null;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION;
        }

        @Override
        public Node build() {
            return new Node.FunctionNode(name, operand);
        }
    }

    final class SubExpressionBuilder implements NodeBuilder {
        private Node inner;

        public SubExpressionBuilder inner(Node inner) {
            this.inner = inner;
            return this;
        }

        public boolean hasInner() {
            return inner != null;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUB_EXPRESSION;
        }

        @Override
        public Node build() {
            return new Node.SubExpressionNode(inner);
        }
    }

    final class ExpressionBuilder implements NodeBuilder {
        private final String operator;
        private Node left;
        private Node right;

        public ExpressionBuilder(String operator) {
            this.operator = operator;
        }

        public String operator() {
            return operator;
        }

        public ExpressionBuilder left(Node left) {
            this.left = left;
            return this;
        }

        public ExpressionBuilder right(Node right) {
            this.right = right;
            return this;
        }

        public boolean hasLeft() {
            return left != null;
        }

        public boolean hasRight() {
            return right != null;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPRESSION;
        }

        @Override
        public Node build() {
            return new Node.ExpressionNode(left, operator, right);
        }
    }
}
