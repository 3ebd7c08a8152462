package com.raditha.sentinel.rule;

import com.raditha.sentinel.model.BinaryOperator;
import com.raditha.sentinel.model.OperationKind;

import java.util.List;

/**
 * Expected shape of one IR operation at a fixed position of a rule's operation sequence.
 * Cross-references name an earlier position of the same sequence whose result temporary must be
 * reused here by identity.
 */
public sealed interface OperationPredicate
        permits OperationPredicate.TypeConversionPredicate, OperationPredicate.BinaryPredicate,
        OperationPredicate.CallPredicate {

    /**
     * Operation kind this predicate accepts.
     */
    OperationKind kind();

    /**
     * Positions of earlier operations this predicate cross-references.
     */
    List<Integer> references();

    /**
     * A conversion of a literal constant to a named type, e.g. {@code address(0)}.
     *
     * @param literalValue source spelling of the literal
     * @param targetType   exact target type name
     */
    record TypeConversionPredicate(String literalValue, String targetType) implements OperationPredicate {
        public TypeConversionPredicate {
            if (literalValue == null || targetType == null || targetType.isEmpty()) {
                throw new IllegalArgumentException("Type conversion predicate needs a literal and a target type");
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.TYPE_CONVERSION;
        }

        @Override
        public List<Integer> references() {
            return List.of();
        }

        @Override
        public String toString() {
            return "CONVERT " + literalValue + " to " + targetType;
        }
    }

    /**
     * A binary operation with one operand taken from an earlier result and the other a named local.
     *
     * @param operator      exact operator
     * @param resultOf      position of the operation whose result is the referenced operand
     * @param referenceSide side holding the referenced result; the named local is on the other side
     * @param namedLocal    name of the user variable on the other side
     */
    record BinaryPredicate(BinaryOperator operator, int resultOf, OperandSide referenceSide, String namedLocal)
            implements OperationPredicate {
        public BinaryPredicate {
            if (operator == null || referenceSide == null) {
                throw new IllegalArgumentException("Binary predicate needs an operator and a reference side");
            }
            if (namedLocal == null || namedLocal.isEmpty()) {
                throw new IllegalArgumentException("Binary predicate needs a named local operand");
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.BINARY;
        }

        @Override
        public List<Integer> references() {
            return List.of(resultOf);
        }

        @Override
        public String toString() {
            String reference = "result#" + resultOf;
            return referenceSide == OperandSide.LEFT
                    ? reference + " " + operator.symbol() + " " + namedLocal
                    : namedLocal + " " + operator.symbol() + " " + reference;
        }
    }

    /**
     * A call to an exact signature whose argument at {@code argumentIndex} is an earlier result.
     */
    record CallPredicate(String signature, int argumentIndex, int resultOf) implements OperationPredicate {
        public CallPredicate {
            if (signature == null || signature.isEmpty()) {
                throw new IllegalArgumentException("Call predicate needs a signature");
            }
            if (argumentIndex < 0) {
                throw new IllegalArgumentException("Argument index must be >= 0, got: " + argumentIndex);
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CALL;
        }

        @Override
        public List<Integer> references() {
            return List.of(resultOf);
        }

        @Override
        public String toString() {
            return "CALL " + signature + " with arg" + argumentIndex + " = result#" + resultOf;
        }
    }
}
