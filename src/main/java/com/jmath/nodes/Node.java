package com.jmath.nodes;

import com.jmath.exceptions.DivisionByZeroException;
import com.jmath.exceptions.IncompleteNodeException;
import com.jmath.exceptions.NumericOverflowException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Node of an expression tree. The variant set is closed; new operations over trees are
 * added by writing a {@link NodeVisitor}, not by extending this interface.
 *
 * <p>Every node owns its children exclusively and never changes after construction.
 * Composite nodes are assembled through {@link NodeBuilder} and validated when frozen.
 */
public sealed interface Node {

    <R> R accept(NodeVisitor<R> visitor);

    NodeKind kind();

    /** Direct children, left to right. Empty for leaves. */
    ImmutableList<Node> children();

    /**
     * This node's own contribution to {@link #complexity()}, children excluded.
     */
    int weight();

    /**
     * Compares the fields this node holds itself, ignoring children.
     */
    boolean sameLabel(Node other);

    default boolean isTerminal() {
        return kind().isTerminal();
    }

    default String getOperator() {
        return "";
    }

    /**
     * Rough estimate of the size of the tree, used to choose between equivalent forms
     * when printing or rewriting.
     */
    default int complexity() {
        return ComplexityScorer.score(this);
    }

    /**
     * Structural equality with another tree. Returns false for {@code null}.
     */
    default boolean compareTo(Node other) {
        return other != null && EqualityComparer.compare(this, other);
    }

    default double evaluate(NodeVisitor<Double> evaluator) {
        return accept(evaluator);
    }

    record IntegerNode(long value) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitInteger(this);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INTEGER;
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.empty();
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public boolean sameLabel(Node other) {
            return equals(other);
        }
    }

    record NumberNode(double value) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NUMBER;
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.empty();
        }

        @Override
        public int weight() {
            return 2;
        }

        @Override
        public boolean sameLabel(Node other) {
            return other instanceof NumberNode n
                && (value == n.value || (Double.isNaN(value) && Double.isNaN(n.value)));
        }
    }

    /**
     * Exact fraction, kept in lowest terms with a positive denominator.
     * Neither part may be {@link Long#MIN_VALUE}, which has no positive counterpart.
     */
    record RationalNode(long numerator, long denominator) implements Node {
        public RationalNode {
            if (denominator == 0) {
                throw new DivisionByZeroException("Rational " + numerator + "/0 has a zero denominator");
            }
            if (numerator == Long.MIN_VALUE || denominator == Long.MIN_VALUE) {
                throw new NumericOverflowException("Rational " + numerator + "/" + denominator + " is out of range");
            }
            long divisor = gcd(Math.abs(numerator), Math.abs(denominator));
            if (denominator < 0) {
                divisor = -divisor;
            }
            numerator /= divisor;
            denominator /= divisor;
        }

        private static long gcd(long a, long b) {
            while (b != 0) {
                long t = a % b;
                a = b;
                b = t;
            }
            return a;
        }

        public double doubleValue() {
            return (double) numerator / denominator;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRational(this);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RATIONAL;
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.empty();
        }

        @Override
        public int weight() {
            return 2;
        }

        @Override
        public boolean sameLabel(Node other) {
            return equals(other);
        }
    }

    record VariableNode(String name) implements Node {
        public VariableNode {
            requireName(name, "Variable");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.VARIABLE;
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.empty();
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public boolean sameLabel(Node other) {
            return equals(other);
        }
    }

    /** Named symbolic constant such as {@code pi} or {@code e}. */
    record ConstantNode(String name) implements Node {
        public ConstantNode {
            requireName(name, "Constant");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CONSTANT;
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.empty();
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public boolean sameLabel(Node other) {
            return equals(other);
        }
    }

    record FunctionNode(String name, Node operand) implements Node {
        public FunctionNode {
            requireName(name, "Function");
            if (operand == null) {
                throw new IncompleteNodeException("Function " + name + " has no operand");
            }
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION;
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.of(operand);
        }

        @Override
        public int weight() {
            return 5;
        }

        @Override
        public boolean sameLabel(Node other) {
            return other instanceof FunctionNode f && name.equals(f.name);
        }
    }

    /** Parenthesized group, kept so printers can reproduce the original grouping. */
    record SubExpressionNode(Node inner) implements Node {
        public SubExpressionNode {
            if (inner == null) {
                throw new IncompleteNodeException("Parenthesized group is empty");
            }
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSubExpression(this);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUB_EXPRESSION;
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.of(inner);
        }

        @Override
        public int weight() {
            return 0;
        }

        @Override
        public boolean sameLabel(Node other) {
            return other instanceof SubExpressionNode;
        }
    }

    /**
     * Operator application. Binary operators fill both slots; unary minus, factorial and
     * square root leave {@code right} null.
     */
    record ExpressionNode(Node left, String operator, Node right) implements Node {
        public ExpressionNode {
            Operators.checkArity(operator, left, right);
        }

        public boolean isUnary() {
            return right == null;
        }

        @Override
        public String getOperator() {
            return operator;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitExpression(this);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPRESSION;
        }

        @Override
        public ImmutableList<Node> children() {
            return right == null ? Lists.immutable.of(left) : Lists.immutable.of(left, right);
        }

        @Override
        public int weight() {
            return Operators.complexityWeight(operator);
        }

        @Override
        public boolean sameLabel(Node other) {
            return other instanceof ExpressionNode e && operator.equals(e.operator);
        }
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(what + " name is required");
        }
    }
}
