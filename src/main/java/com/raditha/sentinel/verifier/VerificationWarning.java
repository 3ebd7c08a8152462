package com.raditha.sentinel.verifier;

/**
 * A non-fatal finding of one verification.
 *
 * @param kind    what was found
 * @param message human readable detail
 */
public record VerificationWarning(WarningKind kind, String message) {

    public static VerificationWarning ambiguousContract(String contractName, int count) {
        return new VerificationWarning(WarningKind.AMBIGUOUS,
                "Ambiguous contract name " + contractName + ": " + count + " contracts share it, using the first");
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
