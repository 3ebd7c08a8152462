package com.raditha.sentinel.cli;

/**
 * What a Sentinel run does.
 */
public enum RunMode {
    /**
     * Verify the configured invariants only.
     */
    VERIFY,

    /**
     * List fuzz entry points only.
     */
    SCAN,

    /**
     * List entry points, then verify invariants. This is the default.
     */
    ALL;

    /**
     * Convert a string value to RunMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding RunMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static RunMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("RunMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "verify" -> VERIFY;
            case "scan" -> SCAN;
            case "all" -> ALL;
            default -> throw new IllegalArgumentException(
                    "Invalid run mode: " + value + ". Must be: verify, scan, or all");
        };
    }

    public boolean scans() {
        return this != VERIFY;
    }

    public boolean verifies() {
        return this != SCAN;
    }
}
