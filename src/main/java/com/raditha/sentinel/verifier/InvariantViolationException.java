package com.raditha.sentinel.verifier;

/**
 * The target exists but its call set or structural pattern no longer satisfies the rule.
 */
public class InvariantViolationException extends VerificationException {

    public InvariantViolationException(VerificationFailure failure) {
        super(failure);
    }
}
