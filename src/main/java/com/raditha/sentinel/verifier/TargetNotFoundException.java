package com.raditha.sentinel.verifier;

/**
 * The rule's target contract or function is not in the model.
 */
public class TargetNotFoundException extends VerificationException {

    public TargetNotFoundException(VerificationFailure failure) {
        super(failure);
    }
}
