package com.raditha.sentinel.verifier;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of verifying one rule.
 *
 * @param ruleName name of the verified rule
 * @param target   {@code Contract.function} the rule applies to
 * @param failure  failing sub-check, null on pass
 * @param warnings non-fatal findings such as an ambiguous contract name
 */
public record VerificationResult(String ruleName, String target, @Nullable VerificationFailure failure,
        List<VerificationWarning> warnings) {

    public VerificationResult {
        warnings = List.copyOf(warnings);
    }

    public static VerificationResult pass(String ruleName, String target, List<VerificationWarning> warnings) {
        return new VerificationResult(ruleName, target, null, warnings);
    }

    public static VerificationResult fail(String ruleName, String target, VerificationFailure failure,
            List<VerificationWarning> warnings) {
        return new VerificationResult(ruleName, target, failure, warnings);
    }

    public boolean passed() {
        return failure == null;
    }

    public Optional<VerificationFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Return this result if it passed, otherwise throw the typed exception for its failure.
     *
     * @throws TargetNotFoundException      when the contract or function is missing
     * @throws InvariantViolationException when the call set or structural pattern is violated
     */
    public VerificationResult orThrow() {
        if (failure != null) {
            throw VerificationException.of(failure);
        }
        return this;
    }
}
