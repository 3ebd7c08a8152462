package com.raditha.sentinel.rule;

import com.raditha.sentinel.model.BinaryOperator;
import com.raditha.sentinel.rule.OperationPredicate.BinaryPredicate;
import com.raditha.sentinel.rule.OperationPredicate.CallPredicate;
import com.raditha.sentinel.rule.OperationPredicate.TypeConversionPredicate;

import java.util.List;

/**
 * Invariants that ship with Sentinel and run when the configuration defines none.
 */
public final class BuiltInRules {

    public static final String DEPOSIT_TRANSACTION_INTEGRITY = "deposit-transaction-integrity";

    private BuiltInRules() {
    }

    /**
     * {@code OptimismPortal.depositTransaction} must call only
     * {@code AddressAliasHelper.applyL1ToL2Alias}, and must still guard contract creation with
     * {@code if (_isCreation) require(_to == address(0), ...)}.
     */
    public static InvariantRule depositTransactionIntegrity() {
        return new InvariantRule(
                DEPOSIT_TRANSACTION_INTEGRITY,
                "OptimismPortal",
                "depositTransaction",
                List.of("AddressAliasHelper.applyL1ToL2Alias"),
                "_isCreation",
                ChildShape.expressionThenBlockEnd(),
                List.of(
                        new TypeConversionPredicate("0", "address"),
                        new BinaryPredicate(BinaryOperator.EQUAL, 0, OperandSide.RIGHT, "_to"),
                        new CallPredicate("require(bool,string)", 0, 1)));
    }

    public static List<InvariantRule> all() {
        return List.of(depositTransactionIntegrity());
    }
}
