package com.raditha.sentinel.model;

/**
 * Discriminator of the closed {@link IrOperation} family, used in diagnostics.
 */
public enum OperationKind {
    CONDITION,
    TYPE_CONVERSION,
    BINARY,
    CALL
}
