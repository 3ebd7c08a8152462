package com.raditha.sentinel.rule;

import com.raditha.sentinel.model.BinaryOperator;
import com.raditha.sentinel.model.NodeKind;
import com.raditha.sentinel.rule.OperationPredicate.BinaryPredicate;
import com.raditha.sentinel.rule.OperationPredicate.CallPredicate;
import com.raditha.sentinel.rule.OperationPredicate.TypeConversionPredicate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvariantRuleTest {

    private static InvariantRule rule(List<OperationPredicate> operations) {
        return new InvariantRule("r", "C", "f", List.of("A.f"), "guard", ChildShape.expressionThenBlockEnd(),
                operations);
    }

    @Test
    void testBuiltInRuleShape() {
        InvariantRule rule = BuiltInRules.depositTransactionIntegrity();

        assertEquals("OptimismPortal.depositTransaction", rule.qualifiedTarget());
        assertEquals(List.of("AddressAliasHelper.applyL1ToL2Alias"), rule.expectedCalls());
        assertEquals(3, rule.expectedOperationSequence().size());
        assertEquals(List.of(NodeKind.EXPRESSION, NodeKind.BLOCK_END), rule.expectedChildShape().kinds());
    }

    @Test
    void testForwardReferenceIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> rule(List.of(
                new BinaryPredicate(BinaryOperator.EQUAL, 1, OperandSide.RIGHT, "_to"),
                new TypeConversionPredicate("0", "address"))));

        assertTrue(e.getMessage().contains("operation 0 may only reference an earlier operation, got 1"));
    }

    @Test
    void testSelfReferenceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> rule(List.of(
                new TypeConversionPredicate("0", "address"),
                new CallPredicate("require(bool)", 0, 1))));
    }

    @Test
    void testMalformedExpectedCallIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InvariantRule("r", "C", "f",
                List.of("noDot"), "guard", ChildShape.expressionThenBlockEnd(),
                List.of(new TypeConversionPredicate("0", "address"))));
    }

    @Test
    void testEmptyOperationSequenceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> rule(List.of()));
    }

    @Test
    void testRuleIsImmutable() {
        InvariantRule rule = BuiltInRules.depositTransactionIntegrity();

        assertThrows(UnsupportedOperationException.class, () -> rule.expectedCalls().add("Other.helper"));
        assertThrows(UnsupportedOperationException.class, () -> rule.expectedOperationSequence().clear());
    }

    @Test
    void testChildShapeDesignatedChildMustBeExpression() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChildShape(List.of(NodeKind.EXPRESSION, NodeKind.BLOCK_END), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ChildShape(List.of(NodeKind.EXPRESSION), 2));
        assertEquals(2, ChildShape.expressionThenBlockEnd().size());
    }
}
