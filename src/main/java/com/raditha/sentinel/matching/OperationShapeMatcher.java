package com.raditha.sentinel.matching;

import com.raditha.sentinel.model.IrOperation;
import com.raditha.sentinel.model.IrOperationVisitor;
import com.raditha.sentinel.model.OperationKind;
import com.raditha.sentinel.model.Variable;
import com.raditha.sentinel.rule.OperandSide;
import com.raditha.sentinel.rule.OperationPredicate;
import com.raditha.sentinel.rule.OperationPredicate.BinaryPredicate;
import com.raditha.sentinel.rule.OperationPredicate.CallPredicate;
import com.raditha.sentinel.rule.OperationPredicate.TypeConversionPredicate;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Checks one IR operation against one {@link OperationPredicate}.
 * <p>
 * Visiting returns an empty Optional when the operation has the expected shape, otherwise the
 * reason it does not. Cross-references are resolved against {@code earlier}, the operations that
 * precede this one in the same node, and compared with {@link Variable#isSameValue(Variable)}.
 */
class OperationShapeMatcher implements IrOperationVisitor<Optional<String>> {

    private final OperationPredicate predicate;
    private final List<IrOperation> earlier;

    OperationShapeMatcher(OperationPredicate predicate, List<IrOperation> earlier) {
        this.predicate = predicate;
        this.earlier = earlier;
    }

    @Override
    public Optional<String> visitCondition(IrOperation.Condition condition) {
        return kindMismatch(OperationKind.CONDITION);
    }

    @Override
    public Optional<String> visitTypeConversion(IrOperation.TypeConversion conversion) {
        if (!(predicate instanceof TypeConversionPredicate expected)) {
            return kindMismatch(conversion.kind());
        }
        if (!(conversion.source() instanceof Variable.Literal literal)) {
            return reject("conversion source " + conversion.source() + " is not a literal");
        }
        if (!sameLiteral(literal.value(), expected.literalValue())) {
            return reject("converts literal " + literal.value() + ", expected " + expected.literalValue());
        }
        if (!conversion.targetType().equals(expected.targetType())) {
            return reject("converts to " + conversion.targetType() + ", expected " + expected.targetType());
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitBinary(IrOperation.Binary binary) {
        if (!(predicate instanceof BinaryPredicate expected)) {
            return kindMismatch(binary.kind());
        }
        if (binary.operator() != expected.operator()) {
            return reject("operator " + binary.operator().symbol() + ", expected " + expected.operator().symbol());
        }
        Optional<Variable.Temporary> referenced = resultOf(expected.resultOf());
        if (referenced.isEmpty()) {
            return reject("operation " + expected.resultOf() + " produces no value to compare");
        }
        Variable referenceOperand = operand(binary, expected.referenceSide());
        if (!referenced.get().isSameValue(referenceOperand)) {
            return reject(sideName(expected.referenceSide()) + " operand " + referenceOperand
                    + " is not the result of operation " + expected.resultOf());
        }
        Variable namedOperand = operand(binary, expected.referenceSide().opposite());
        if (!(namedOperand instanceof Variable.NamedLocal local) || !local.name().equals(expected.namedLocal())) {
            return reject(sideName(expected.referenceSide().opposite()) + " operand " + namedOperand
                    + " is not the local " + expected.namedLocal());
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitCall(IrOperation.Call call) {
        if (!(predicate instanceof CallPredicate expected)) {
            return kindMismatch(call.kind());
        }
        if (!call.signature().equals(expected.signature())) {
            return reject("calls " + call.signature() + ", expected " + expected.signature());
        }
        if (call.arguments().size() <= expected.argumentIndex()) {
            return reject("call has " + call.arguments().size() + " argument(s), needs argument "
                    + expected.argumentIndex());
        }
        Optional<Variable.Temporary> referenced = resultOf(expected.resultOf());
        Variable argument = call.arguments().get(expected.argumentIndex());
        if (referenced.isEmpty() || !referenced.get().isSameValue(argument)) {
            return reject("argument " + expected.argumentIndex() + " (" + argument
                    + ") is not the result of operation " + expected.resultOf());
        }
        return Optional.empty();
    }

    /**
     * Numeric literals compare by value, so {@code 0}, {@code 00} and {@code 0x0} are equal.
     * Anything else compares as text.
     */
    static boolean sameLiteral(String actual, String expected) {
        Optional<BigInteger> actualNumber = numericValue(actual);
        Optional<BigInteger> expectedNumber = numericValue(expected);
        if (actualNumber.isPresent() && expectedNumber.isPresent()) {
            return actualNumber.get().equals(expectedNumber.get());
        }
        return actual.equals(expected);
    }

    private static Optional<BigInteger> numericValue(String literal) {
        String digits = literal.trim().replace("_", "");
        int radix = 10;
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
            radix = 16;
        }
        if (digits.isEmpty() || digits.startsWith("-") || digits.startsWith("+")) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigInteger(digits, radix));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private Optional<Variable.Temporary> resultOf(int position) {
        return earlier.get(position).result();
    }

    private static Variable operand(IrOperation.Binary binary, OperandSide side) {
        return side == OperandSide.LEFT ? binary.left() : binary.right();
    }

    private static String sideName(OperandSide side) {
        return side == OperandSide.LEFT ? "left" : "right";
    }

    private Optional<String> kindMismatch(OperationKind actual) {
        return reject("found " + actual + ", expected " + predicate.kind());
    }

    private static Optional<String> reject(String reason) {
        return Optional.of(reason);
    }
}
