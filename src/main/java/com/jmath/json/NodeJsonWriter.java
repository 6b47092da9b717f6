package com.jmath.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.jmath.nodes.DepthLimit;
import com.jmath.nodes.Node;
import com.jmath.nodes.NodeVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes a tree in the format read by {@link NodeJsonReader}, either pretty-printed or
 * on a single line. Non-finite numbers are written as the strings {@code "NaN"},
 * {@code "Infinity"} and {@code "-Infinity"}.
 */
public class NodeJsonWriter {
    private final JsonFactory factory = new JsonFactoryBuilder()
        .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
        .build();
    private final boolean prettyPrint;
    private final int maxDepth;

    public NodeJsonWriter(boolean prettyPrint) {
        this(prettyPrint, DepthLimit.DEFAULT_MAX_DEPTH);
    }

    public NodeJsonWriter(boolean prettyPrint, int maxDepth) {
        this.prettyPrint = prettyPrint;
        this.maxDepth = maxDepth;
    }

    public String write(Node node) {
        StringWriter out = new StringWriter();
        try {
            write(node, out);
        } catch (IOException e) {
            // StringWriter does not fail
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Writes the tree and flushes {@code output}, leaving it open.
     */
    public void write(Node node, Writer output) throws IOException {
        try (JsonGenerator generator = factory.createGenerator(output)) {
            writeTree(node, generator);
        }
    }

    private void writeTree(Node node, JsonGenerator generator) throws IOException {
        if (prettyPrint) {
            generator.useDefaultPrettyPrinter();
        }
        try {
            new TreeWriter(generator, new DepthLimit(maxDepth)).write(node);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Visitors cannot throw checked exceptions, so I/O failures travel as
     * {@link UncheckedIOException} and are unwrapped in {@link #writeTree}.
     */
    private static final class TreeWriter implements NodeVisitor<Void> {
        private final JsonGenerator generator;
        private final DepthLimit depthLimit;

        TreeWriter(JsonGenerator generator, DepthLimit depthLimit) {
            this.generator = generator;
            this.depthLimit = depthLimit;
        }

        void write(Node node) {
            depthLimit.enter();
            try {
                generator.writeStartObject();
                generator.writeStringField("type", node.kind().label());
                node.accept(this);
                generator.writeEndObject();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } finally {
                depthLimit.exit();
            }
        }

        private void child(String fieldName, Node child) throws IOException {
            generator.writeFieldName(fieldName);
            write(child);
        }

        @Override
        public Void visitInteger(Node.IntegerNode node) {
            try {
                generator.writeNumberField("value", node.value());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitNumber(Node.NumberNode node) {
            try {
                generator.writeNumberField("value", node.value());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitRational(Node.RationalNode node) {
            try {
                generator.writeNumberField("numerator", node.numerator());
                generator.writeNumberField("denominator", node.denominator());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitVariable(Node.VariableNode node) {
            try {
                generator.writeStringField("name", node.name());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitConstant(Node.ConstantNode node) {
            try {
                generator.writeStringField("name", node.name());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitFunction(Node.FunctionNode node) {
            try {
                generator.writeStringField("name", node.name());
                child("operand", node.operand());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitSubExpression(Node.SubExpressionNode node) {
            try {
                child("inner", node.inner());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitExpression(Node.ExpressionNode node) {
            try {
                generator.writeStringField("operator", node.operator());
                child("left", node.left());
                if (!node.isUnary()) {
                    child("right", node.right());
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }
    }
}
