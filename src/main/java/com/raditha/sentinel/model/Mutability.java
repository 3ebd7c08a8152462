package com.raditha.sentinel.model;

/**
 * State mutability of a contract function.
 */
public enum Mutability {
    PURE,
    VIEW,
    MUTATING;

    /**
     * Convert a string value to Mutability.
     * {@code nonpayable} and {@code payable} both map to {@link #MUTATING}.
     *
     * @param value the mutability keyword (case-insensitive)
     * @return the corresponding Mutability
     * @throws IllegalArgumentException if the value is not recognised
     */
    public static Mutability fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Mutability value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "pure" -> PURE;
            case "view" -> VIEW;
            case "mutating", "nonpayable", "payable" -> MUTATING;
            default -> throw new IllegalArgumentException(
                    "Invalid mutability: " + value + ". Must be: pure, view, or mutating");
        };
    }

    public boolean isReadOnly() {
        return this == PURE || this == VIEW;
    }
}
