package com.raditha.sentinel.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * A lowered IR operation attached to a {@link CfgNode}.
 * The family is closed; dispatch with {@link #accept(IrOperationVisitor)}.
 */
public sealed interface IrOperation
        permits IrOperation.Condition, IrOperation.TypeConversion, IrOperation.Binary, IrOperation.Call {

    OperationKind kind();

    /**
     * The temporary this operation writes, if it produces a value.
     */
    Optional<Variable.Temporary> result();

    <R> R accept(IrOperationVisitor<R> visitor);

    /**
     * Branch condition of a CONDITIONAL node.
     */
    record Condition(Variable value) implements IrOperation {
        public Condition {
            requireOperand(value, "condition value");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CONDITION;
        }

        @Override
        public Optional<Variable.Temporary> result() {
            return Optional.empty();
        }

        @Override
        public <R> R accept(IrOperationVisitor<R> visitor) {
            return visitor.visitCondition(this);
        }

        @Override
        public String toString() {
            return "CONDITION " + value;
        }
    }

    /**
     * Conversion of {@code source} to {@code targetType}, written to {@code resultVar}.
     */
    record TypeConversion(Variable source, String targetType, Variable.Temporary resultVar) implements IrOperation {
        public TypeConversion {
            requireOperand(source, "conversion source");
            requireOperand(resultVar, "conversion result");
            if (targetType == null || targetType.isEmpty()) {
                throw new IllegalArgumentException("Conversion target type cannot be empty");
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.TYPE_CONVERSION;
        }

        @Override
        public Optional<Variable.Temporary> result() {
            return Optional.of(resultVar);
        }

        @Override
        public <R> R accept(IrOperationVisitor<R> visitor) {
            return visitor.visitTypeConversion(this);
        }

        @Override
        public String toString() {
            return resultVar + " = CONVERT " + source + " to " + targetType;
        }
    }

    /**
     * {@code resultVar = left operator right}.
     */
    record Binary(BinaryOperator operator, Variable left, Variable right, Variable.Temporary resultVar)
            implements IrOperation {
        public Binary {
            if (operator == null) {
                throw new IllegalArgumentException("Binary operator cannot be null");
            }
            requireOperand(left, "left operand");
            requireOperand(right, "right operand");
            requireOperand(resultVar, "binary result");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.BINARY;
        }

        @Override
        public Optional<Variable.Temporary> result() {
            return Optional.of(resultVar);
        }

        @Override
        public <R> R accept(IrOperationVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return resultVar + " = " + left + " " + operator.symbol() + " " + right;
        }
    }

    /**
     * Call of a function identified by its full signature, e.g. {@code require(bool,string)}.
     */
    record Call(String signature, List<Variable> arguments, Variable.@Nullable Temporary resultVar)
            implements IrOperation {
        public Call {
            if (signature == null || signature.isEmpty()) {
                throw new IllegalArgumentException("Call signature cannot be empty");
            }
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CALL;
        }

        @Override
        public Optional<Variable.Temporary> result() {
            return Optional.ofNullable(resultVar);
        }

        @Override
        public <R> R accept(IrOperationVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            String call = "CALL " + signature + arguments;
            return resultVar == null ? call : resultVar + " = " + call;
        }
    }

    private static void requireOperand(Object operand, String what) {
        if (operand == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
    }
}
