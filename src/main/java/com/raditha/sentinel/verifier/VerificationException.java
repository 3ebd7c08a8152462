package com.raditha.sentinel.verifier;

/**
 * Raised when a verified invariant does not hold. Carries the {@link VerificationFailure}
 * so callers can report the failing sub-check.
 */
public abstract class VerificationException extends RuntimeException {

    private final transient VerificationFailure failure;

    protected VerificationException(VerificationFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public VerificationFailure getFailure() {
        return failure;
    }

    /**
     * Wrap a failure in the exception type matching its kind.
     */
    public static VerificationException of(VerificationFailure failure) {
        return switch (failure.kind()) {
            case NOT_FOUND -> new TargetNotFoundException(failure);
            case INVARIANT_VIOLATION -> new InvariantViolationException(failure);
        };
    }
}
