package com.raditha.sentinel.rule;

import com.raditha.sentinel.model.HighLevelCall;

import java.util.List;

/**
 * Declarative description of one structural invariant on a single function.
 * <p>
 * The target function must make exactly {@code expectedCalls} (as a multiset) and must contain a
 * CONDITIONAL node branching on {@code guardVariableName} whose children have
 * {@code expectedChildShape} and whose designated EXPRESSION child carries exactly
 * {@code expectedOperationSequence}.
 *
 * @param name                      rule name used in reports
 * @param targetContract            contract to locate
 * @param targetFunction            function to locate within the contract
 * @param expectedCalls             {@code Contract.function} entries, duplicates counted
 * @param guardVariableName         named local the guard branches on, case-sensitive
 * @param expectedChildShape        required children of the guard node
 * @param expectedOperationSequence exact operation sequence of the designated child
 */
public record InvariantRule(
        String name,
        String targetContract,
        String targetFunction,
        List<String> expectedCalls,
        String guardVariableName,
        ChildShape expectedChildShape,
        List<OperationPredicate> expectedOperationSequence) {

    public InvariantRule {
        requireText(name, "name");
        requireText(targetContract, "targetContract");
        requireText(targetFunction, "targetFunction");
        requireText(guardVariableName, "guardVariableName");
        if (expectedChildShape == null) {
            throw new IllegalArgumentException("Rule " + name + " needs an expected child shape");
        }
        expectedCalls = expectedCalls == null ? List.of() : List.copyOf(expectedCalls);
        for (String call : expectedCalls) {
            HighLevelCall.parse(call);
        }
        if (expectedOperationSequence == null || expectedOperationSequence.isEmpty()) {
            throw new IllegalArgumentException("Rule " + name + " needs at least one expected operation");
        }
        expectedOperationSequence = List.copyOf(expectedOperationSequence);
        for (int i = 0; i < expectedOperationSequence.size(); i++) {
            for (int ref : expectedOperationSequence.get(i).references()) {
                if (ref < 0 || ref >= i) {
                    throw new IllegalArgumentException("Rule " + name + ": operation " + i
                            + " may only reference an earlier operation, got " + ref);
                }
            }
        }
    }

    /**
     * Target in {@code Contract.function} form.
     */
    public String qualifiedTarget() {
        return targetContract + "." + targetFunction;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Invariant rule " + field + " cannot be empty");
        }
    }
}
