package com.jmath.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.jmath.exceptions.MathAstException;
import com.jmath.nodes.Node;
import com.jmath.nodes.NodeBuilder;
import com.jmath.nodes.NodeKind;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads an expression tree from its JSON form, one object per node:
 *
 * <pre>{@code
 * {"type": "expression", "operator": "+",
 *  "left": {"type": "variable", "name": "x"},
 *  "right": {"type": "integer", "value": 1}}
 * }</pre>
 *
 * Composite nodes go through {@link NodeBuilder}, so a tree that could not be built by a
 * parser cannot be read either. A node may only carry the fields of its own kind. Number
 * values also accept the strings {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"}
 * that {@link NodeJsonWriter} emits for non-finite values.
 */
public class NodeJsonReader {
    private static final Logger log = LoggerFactory.getLogger(NodeJsonReader.class);

    private static final ImmutableSet<String> NON_FINITE = Sets.immutable.of("NaN", "Infinity", "-Infinity");

    private final JsonFactory factory = new JsonFactory();

    public Node parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseRoot(parser);
        }
    }

    public Node parse(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return parseRoot(parser);
        }
    }

    private Node parseRoot(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Expected a node object but got " + token);
        }
        Node root = parseNode(parser);
        log.debug("Read tree of kind {}", root.kind().label());
        return root;
    }

    /** Parser is positioned on the START_OBJECT of the node. */
    private Node parseNode(JsonParser parser) throws IOException {
        Fields fields = new Fields();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken token = parser.nextToken();
            fields.present.add(fieldName);

            switch (fieldName) {
                case "type" -> fields.type = text(parser, token, fieldName);
                case "name" -> fields.name = text(parser, token, fieldName);
                case "operator" -> fields.operator = text(parser, token, fieldName);
                case "value" -> {
                    if (token == JsonToken.VALUE_NUMBER_INT) {
                        fields.integral = true;
                        fields.longValue = parser.getLongValue();
                        fields.doubleValue = parser.getDoubleValue();
                    } else if (token == JsonToken.VALUE_NUMBER_FLOAT) {
                        fields.doubleValue = parser.getDoubleValue();
                    } else if (token == JsonToken.VALUE_STRING && NON_FINITE.contains(parser.getText())) {
                        fields.doubleValue = Double.parseDouble(parser.getText());
                    } else {
                        throw new IOException("Field 'value' must be a number, got " + token);
                    }
                    fields.hasValue = true;
                }
                case "numerator" -> fields.numerator = integer(parser, token, fieldName);
                case "denominator" -> fields.denominator = integer(parser, token, fieldName);
                case "operand" -> fields.operand = child(parser, token, fieldName);
                case "inner" -> fields.inner = child(parser, token, fieldName);
                case "left" -> fields.left = child(parser, token, fieldName);
                case "right" -> fields.right = child(parser, token, fieldName);
                default -> throw new IOException("Unexpected field: " + fieldName);
            }
        }

        if (fields.type == null) {
            throw new IOException("Node object has no 'type'");
        }

        try {
            return build(fields);
        } catch (MathAstException | IllegalArgumentException e) {
            throw new IOException("Invalid " + fields.type + " node: " + e.getMessage(), e);
        }
    }

    private Node build(Fields fields) throws IOException {
        NodeKind kind = NodeKind.fromLabel(fields.type);
        ImmutableSet<String> allowed = fieldsOf(kind);
        String stray = fields.present.detect(name -> !allowed.contains(name));
        if (stray != null) {
            throw new IOException("Field '" + stray + "' does not belong to a " + kind.label() + " node");
        }

        return switch (kind) {
            case INTEGER -> {
                if (!fields.hasValue || !fields.integral) {
                    throw new IOException("Integer node needs an integral 'value'");
                }
                yield new Node.IntegerNode(fields.longValue);
            }
            case NUMBER -> {
                if (!fields.hasValue) {
                    throw new IOException("Number node needs a 'value'");
                }
                yield new Node.NumberNode(fields.doubleValue);
            }
            case RATIONAL -> {
                if (fields.numerator == null || fields.denominator == null) {
                    throw new IOException("Rational node needs 'numerator' and 'denominator'");
                }
                yield new Node.RationalNode(fields.numerator, fields.denominator);
            }
            case VARIABLE -> new Node.VariableNode(fields.name);
            case CONSTANT -> new Node.ConstantNode(fields.name);
            case FUNCTION -> new NodeBuilder.FunctionBuilder(fields.name)
                .operand(fields.operand)
                .build();
            case SUB_EXPRESSION -> new NodeBuilder.SubExpressionBuilder()
                .inner(fields.inner)
                .build();
            case EXPRESSION -> new NodeBuilder.ExpressionBuilder(fields.operator)
                .left(fields.left)
                .right(fields.right)
                .build();
        };
    }

    private static ImmutableSet<String> fieldsOf(NodeKind kind) {
        return switch (kind) {
            case INTEGER, NUMBER -> Sets.immutable.of("type", "value");
            case RATIONAL -> Sets.immutable.of("type", "numerator", "denominator");
            case VARIABLE, CONSTANT -> Sets.immutable.of("type", "name");
            case FUNCTION -> Sets.immutable.of("type", "name", "operand");
            case SUB_EXPRESSION -> Sets.immutable.of("type", "inner");
            case EXPRESSION -> Sets.immutable.of("type", "operator", "left", "right");
        };
    }

    private Node child(JsonParser parser, JsonToken token, String fieldName) throws IOException {
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Field '" + fieldName + "' must be a node object, got " + token);
        }
        return parseNode(parser);
    }

    private static String text(JsonParser parser, JsonToken token, String fieldName) throws IOException {
        if (token != JsonToken.VALUE_STRING) {
            throw new IOException("Field '" + fieldName + "' must be a string, got " + token);
        }
        return parser.getText();
    }

    private static Long integer(JsonParser parser, JsonToken token, String fieldName) throws IOException {
        if (token != JsonToken.VALUE_NUMBER_INT) {
            throw new IOException("Field '" + fieldName + "' must be an integer, got " + token);
        }
        return parser.getLongValue();
    }

    private static final class Fields {
        String type;
        String name;
        String operator;
        boolean hasValue;
        boolean integral;
        long longValue;
        double doubleValue;
        Long numerator;
        Long denominator;
        Node operand;
        Node inner;
        Node left;
        Node right;
        final MutableList<String> present = Lists.mutable.empty();
    }
}
