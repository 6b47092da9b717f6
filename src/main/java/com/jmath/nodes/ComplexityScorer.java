package com.jmath.nodes;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sums {@link Node#weight()} over a tree. Iterative, so arbitrarily deep trees are fine.
 *
 * <p>Weights: integers, variables and constants 1; floats and rationals 2; functions 5;
 * parentheses 0; {@code + - *} 2; {@code /} and {@code !} 4; {@code sqrt} 5; {@code ^} 8.
 * Any other operator fails with {@link com.jmath.exceptions.UnknownOperatorException}.
 */
public final class ComplexityScorer {
    private ComplexityScorer() {
    }

    public static int score(Node root) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);

        int total = 0;
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            total += node.weight();
            node.children().each(pending::push);
        }
        return total;
    }
}
