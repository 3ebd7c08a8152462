package com.raditha.sentinel.model;

/**
 * Kind tag of a control-flow graph node.
 * The set is closed: analyzer node types that have no counterpart here are reported as {@link #OTHER}.
 */
public enum NodeKind {
    /**
     * Branch on a condition (an {@code if} statement).
     */
    CONDITIONAL,

    /**
     * A single expression statement.
     */
    EXPRESSION,

    /**
     * End of a conditional block (the join point of an {@code if}).
     */
    BLOCK_END,

    OTHER;

    /**
     * Convert an analyzer node type name to a NodeKind.
     * Accepts both the enum names and the analyzer spellings ({@code IF}, {@code END_IF}).
     *
     * @param value the node type name (case-insensitive)
     * @return the matching kind, or {@link #OTHER} for unrecognised names
     */
    public static NodeKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("NodeKind value cannot be null");
        }
        return switch (value.trim().toUpperCase().replace('-', '_')) {
            case "CONDITIONAL", "IF" -> CONDITIONAL;
            case "EXPRESSION" -> EXPRESSION;
            case "BLOCK_END", "END_IF", "ENDIF" -> BLOCK_END;
            default -> OTHER;
        };
    }
}
