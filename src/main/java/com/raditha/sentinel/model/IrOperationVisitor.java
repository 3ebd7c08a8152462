package com.raditha.sentinel.model;

/**
 * Exhaustive visitor over the {@link IrOperation} kinds.
 * Adding an operation kind adds a method here, so every consumer has to handle it explicitly.
 *
 * @param <R> result type
 */
public interface IrOperationVisitor<R> {

    R visitCondition(IrOperation.Condition condition);

    R visitTypeConversion(IrOperation.TypeConversion conversion);

    R visitBinary(IrOperation.Binary binary);

    R visitCall(IrOperation.Call call);
}
