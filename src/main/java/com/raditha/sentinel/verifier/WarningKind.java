package com.raditha.sentinel.verifier;

/**
 * Non-fatal findings reported alongside a verification result.
 */
public enum WarningKind {
    /**
     * Several contracts share the target name. The first one in model order was verified.
     */
    AMBIGUOUS
}
