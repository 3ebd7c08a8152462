package com.raditha.sentinel.model;

/**
 * Operators of a {@link IrOperation.Binary} operation.
 */
public enum BinaryOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    AND("&&"),
    OR("||"),
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolve an operator from either its symbol ({@code ==}) or its name ({@code EQUAL}).
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static BinaryOperator fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("BinaryOperator value cannot be null");
        }
        String trimmed = value.trim();
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed.replace('-', '_'))) {
                return op;
            }
        }
        throw new IllegalArgumentException("Invalid binary operator: " + value);
    }
}
