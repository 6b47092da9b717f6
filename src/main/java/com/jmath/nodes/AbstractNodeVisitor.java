package com.jmath.nodes;

import com.jmath.exceptions.UnknownNodeVariantException;

/**
 * Visitor base for operations that only support part of the variant set. Every case
 * fails with {@link UnknownNodeVariantException} until overridden.
 */
public abstract class AbstractNodeVisitor<R> implements NodeVisitor<R> {

    protected R unsupported(Node node) {
        throw new UnknownNodeVariantException(getClass().getName(), node.kind().label());
    }

    @Override
    public R visitInteger(Node.IntegerNode node) {
        return unsupported(node);
    }

    @Override
    public R visitNumber(Node.NumberNode node) {
        return unsupported(node);
    }

    @Override
    public R visitRational(Node.RationalNode node) {
        return unsupported(node);
    }

    @Override
    public R visitVariable(Node.VariableNode node) {
        return unsupported(node);
    }

    @Override
    public R visitConstant(Node.ConstantNode node) {
        return unsupported(node);
    }

    @Override
    public R visitFunction(Node.FunctionNode node) {
        return unsupported(node);
    }

    @Override
    public R visitSubExpression(Node.SubExpressionNode node) {
        return unsupported(node);
    }

    @Override
    public R visitExpression(Node.ExpressionNode node) {
        return unsupported(node);
    }
}
