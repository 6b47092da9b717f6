package com.jmath.nodes;

/**
 * Operation over expression trees, one case per node variant. Nodes dispatch to the
 * matching case through {@link Node#accept(NodeVisitor)}; implementations recurse into
 * children by calling {@code accept} on them.
 *
 * @param <R> result type of the operation
 */
public interface NodeVisitor<R> {
    R visitInteger(Node.IntegerNode node);

    R visitNumber(Node.NumberNode node);

    R visitRational(Node.RationalNode node);

    R visitVariable(Node.VariableNode node);

    R visitConstant(Node.ConstantNode node);

    R visitFunction(Node.FunctionNode node);

    R visitSubExpression(Node.SubExpressionNode node);

    R visitExpression(Node.ExpressionNode node);
}
