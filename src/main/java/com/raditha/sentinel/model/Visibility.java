package com.raditha.sentinel.model;

/**
 * Visibility of a contract function.
 */
public enum Visibility {
    PUBLIC,
    EXTERNAL,
    INTERNAL,
    PRIVATE;

    /**
     * Convert a string value to Visibility.
     *
     * @param value the visibility keyword (case-insensitive)
     * @return the corresponding Visibility
     * @throws IllegalArgumentException if the value is not a valid visibility
     */
    public static Visibility fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Visibility value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "public" -> PUBLIC;
            case "external" -> EXTERNAL;
            case "internal" -> INTERNAL;
            case "private" -> PRIVATE;
            default -> throw new IllegalArgumentException(
                    "Invalid visibility: " + value + ". Must be: public, external, internal, or private");
        };
    }
}
