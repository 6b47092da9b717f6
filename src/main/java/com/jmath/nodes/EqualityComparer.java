package com.jmath.nodes;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Structural equality of expression trees: same variants, same values, same operators,
 * all the way down. Iterative, like {@link ComplexityScorer}.
 */
public final class EqualityComparer {
    private EqualityComparer() {
    }

    public static boolean compare(Node a, Node b) {
        if (a == null || b == null) {
            return a == b;
        }

        Deque<Node[]> pending = new ArrayDeque<>();
        pending.push(new Node[] {a, b});

        while (!pending.isEmpty()) {
            Node[] pair = pending.pop();
            Node left = pair[0];
            Node right = pair[1];
            if (left == right) {
                continue;
            }
            if (!left.sameLabel(right)) {
                return false;
            }

            ImmutableList<Node> leftChildren = left.children();
            ImmutableList<Node> rightChildren = right.children();
            if (leftChildren.size() != rightChildren.size()) {
                return false;
            }
            for (int i = 0; i < leftChildren.size(); i++) {
                pending.push(new Node[] {leftChildren.get(i), rightChildren.get(i)});
            }
        }
        return true;
    }
}
