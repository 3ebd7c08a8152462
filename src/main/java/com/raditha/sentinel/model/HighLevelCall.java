package com.raditha.sentinel.model;

/**
 * An outgoing call from a function into another contract's function.
 *
 * @param contractName name of the callee contract
 * @param functionName name of the callee function
 */
public record HighLevelCall(String contractName, String functionName) {

    public HighLevelCall {
        if (contractName == null || contractName.isEmpty() || functionName == null || functionName.isEmpty()) {
            throw new IllegalArgumentException("High level call needs both a contract and a function name");
        }
    }

    /**
     * Parse a {@code Contract.function} string.
     */
    public static HighLevelCall parse(String qualified) {
        int dot = qualified == null ? -1 : qualified.indexOf('.');
        if (dot <= 0 || dot == qualified.length() - 1) {
            throw new IllegalArgumentException("Expected Contract.function, got: " + qualified);
        }
        return new HighLevelCall(qualified.substring(0, dot), qualified.substring(dot + 1));
    }

    /**
     * The call in {@code Contract.function} form.
     */
    public String qualifiedName() {
        return contractName + "." + functionName;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
