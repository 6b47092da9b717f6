package com.jmath.nodes;

import com.jmath.lexing.Token;
import com.jmath.lexing.TokenType;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.function.ToLongFunction;

/**
 * Turns a single token into a leaf node or into a builder for a composite node.
 *
 * <p>Tokens that do not start a node (closing parentheses, separators, operators outside
 * the allowed set) give an empty result. Parsers try tokens this way all the time, so
 * it is not treated as an error.
 */
public class NodeFactory {
    private static final Logger log = LoggerFactory.getLogger(NodeFactory.class);

    public static final ImmutableSet<TokenType> ARITHMETIC_OPERATORS = Sets.immutable.of(
        TokenType.ADDITION_OPERATOR,
        TokenType.SUBTRACTION_OPERATOR,
        TokenType.MULTIPLICATION_OPERATOR,
        TokenType.DIVISION_OPERATOR,
        TokenType.EXPONENTIATION_OPERATOR);

    public static final ImmutableSet<TokenType> ALL_OPERATORS = ARITHMETIC_OPERATORS.newWithAll(
        Sets.immutable.of(TokenType.FACTORIAL_OPERATOR, TokenType.SQUARE_ROOT_OPERATOR));

    private final ImmutableSet<TokenType> allowedOperators;
    private final ToLongFunction<String> integerParser;
    private final ToDoubleFunction<String> realParser;

    public NodeFactory(ImmutableSet<TokenType> allowedOperators) {
        this(allowedOperators, Long::parseLong, Double::parseDouble);
    }

    public NodeFactory(ImmutableSet<TokenType> allowedOperators,
                       ToLongFunction<String> integerParser,
                       ToDoubleFunction<String> realParser) {
        ImmutableSet<TokenType> unknown = allowedOperators.difference(ALL_OPERATORS);
        if (unknown.notEmpty()) {
            throw new IllegalArgumentException("Not operator token types: " + unknown);
        }
        this.allowedOperators = allowedOperators;
        this.integerParser = integerParser;
        this.realParser = realParser;
    }

    /** Arithmetic operators only: {@code + - * / ^}. */
    public static NodeFactory restricted() {
        return new NodeFactory(ARITHMETIC_OPERATORS);
    }

    /** Arithmetic operators plus factorial and square root. */
    public static NodeFactory full() {
        return new NodeFactory(ALL_OPERATORS);
    }

    public ImmutableSet<TokenType> allowedOperators() {
        return allowedOperators;
    }

    public Optional<NodeBuilder> create(Token token) {
        TokenType type = token.type();
        String value = token.value();

        NodeBuilder builder = switch (type) {
            case POS_INT, INTEGER -> new NodeBuilder.Leaf(new Node.IntegerNode(integerParser.applyAsLong(value)));
            case REAL_NUMBER -> new NodeBuilder.Leaf(new Node.NumberNode(realParser.applyAsDouble(value)));
            case IDENTIFIER -> new NodeBuilder.Leaf(new Node.VariableNode(value));
            case CONSTANT -> new NodeBuilder.Leaf(new Node.ConstantNode(value));
            case FUNCTION_NAME -> new NodeBuilder.FunctionBuilder(value);
            case OPEN_PARENTHESIS -> new NodeBuilder.SubExpressionBuilder();
            default -> allowedOperators.contains(type) ? new NodeBuilder.ExpressionBuilder(value) : null;
        };

        if (builder == null) {
            log.trace("No node for {}", token);
        }
        return Optional.ofNullable(builder);
    }
}
