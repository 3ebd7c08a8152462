package com.raditha.sentinel.verifier;

/**
 * Failure taxonomy of a verification.
 */
public enum FailureKind {
    /**
     * Target contract or function is absent from the model.
     */
    NOT_FOUND,

    /**
     * The call set changed or the structural pattern is gone.
     */
    INVARIANT_VIOLATION
}
