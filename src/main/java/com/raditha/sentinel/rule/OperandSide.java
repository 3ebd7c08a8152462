package com.raditha.sentinel.rule;

/**
 * Which operand of a binary operation a predicate constrains.
 */
public enum OperandSide {
    LEFT,
    RIGHT;

    public OperandSide opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }

    public static OperandSide fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OperandSide value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "left" -> LEFT;
            case "right" -> RIGHT;
            default -> throw new IllegalArgumentException(
                    "Invalid operand side: " + value + ". Must be: left or right");
        };
    }
}
