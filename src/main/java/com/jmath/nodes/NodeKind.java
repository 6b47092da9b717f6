package com.jmath.nodes;

public enum NodeKind {
    INTEGER("integer", true),
    NUMBER("number", true),
    RATIONAL("rational", true),
    VARIABLE("variable", true),
    CONSTANT("constant", true),
    FUNCTION("function", false),
    SUB_EXPRESSION("subexpression", false),
    EXPRESSION("expression", false);

    private final String label;
    private final boolean terminal;

    NodeKind(String label, boolean terminal) {
        this.label = label;
        this.terminal = terminal;
    }

    /** Lower-case name used in messages and in the JSON tree format. */
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static NodeKind fromLabel(String label) {
        for (NodeKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + label);
    }
}
