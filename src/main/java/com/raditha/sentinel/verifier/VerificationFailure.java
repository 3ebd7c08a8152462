package com.raditha.sentinel.verifier;

/**
 * The sub-check that failed and why.
 *
 * @param kind    failure category
 * @param check   failed sub-check: {@code contract}, {@code function}, {@code call-set} or
 *                {@code structural-pattern}
 * @param message message naming the check and its detail
 */
public record VerificationFailure(FailureKind kind, String check, String message) {

    public static final String CONTRACT = "contract";
    public static final String FUNCTION = "function";
    public static final String CALL_SET = "call-set";
    public static final String STRUCTURAL_PATTERN = "structural-pattern";

    public static VerificationFailure contractNotFound(String contractName) {
        return new VerificationFailure(FailureKind.NOT_FOUND, CONTRACT,
                "Could not find " + contractName + " contract");
    }

    public static VerificationFailure functionNotFound(String contractName, String functionName) {
        return new VerificationFailure(FailureKind.NOT_FOUND, FUNCTION,
                "Could not find " + contractName + "." + functionName + " function");
    }

    public static VerificationFailure callSetMismatch(String target, CallSetDiff diff) {
        return new VerificationFailure(FailureKind.INVARIANT_VIOLATION, CALL_SET,
                target + " high level calls changed: " + diff.describe());
    }

    public static VerificationFailure structuralPatternNotFound(String target, String guardVariable, String detail) {
        return new VerificationFailure(FailureKind.INVARIANT_VIOLATION, STRUCTURAL_PATTERN,
                "structural pattern not found: no " + guardVariable + " guard with the expected operations in "
                        + target + " (" + detail + ")");
    }
}
