package com.raditha.sentinel.rule;

import com.raditha.sentinel.model.NodeKind;

import java.util.List;

/**
 * Required children of a guard node: their exact count and kinds in order, and which child is the
 * EXPRESSION node whose operations are matched.
 *
 * @param kinds           child kinds in order
 * @param expressionIndex position of the designated EXPRESSION child
 */
public record ChildShape(List<NodeKind> kinds, int expressionIndex) {

    public ChildShape {
        if (kinds == null || kinds.isEmpty()) {
            throw new IllegalArgumentException("Child shape needs at least one child kind");
        }
        kinds = List.copyOf(kinds);
        if (expressionIndex < 0 || expressionIndex >= kinds.size()) {
            throw new IllegalArgumentException("Expression index " + expressionIndex
                    + " is outside the " + kinds.size() + " expected children");
        }
        if (kinds.get(expressionIndex) != NodeKind.EXPRESSION) {
            throw new IllegalArgumentException("Designated child " + expressionIndex + " must be EXPRESSION, was "
                    + kinds.get(expressionIndex));
        }
    }

    /**
     * An if-block holding a single statement: EXPRESSION then BLOCK_END.
     */
    public static ChildShape expressionThenBlockEnd() {
        return new ChildShape(List.of(NodeKind.EXPRESSION, NodeKind.BLOCK_END), 0);
    }

    public int size() {
        return kinds.size();
    }
}
