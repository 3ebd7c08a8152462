package com.raditha.sentinel.model;

import java.util.List;

/**
 * A contract function as seen by the analyzer.
 *
 * @param name            function name without parameters
 * @param parameterTypes  ordered parameter type names
 * @param visibility      declared visibility
 * @param mutability      declared state mutability
 * @param nodes           CFG nodes; enumeration order carries no meaning
 * @param highLevelCalls  outgoing calls into other contracts, duplicates preserved
 */
public record Function(
        String name,
        List<String> parameterTypes,
        Visibility visibility,
        Mutability mutability,
        List<CfgNode> nodes,
        List<HighLevelCall> highLevelCalls) {

    public Function {
        if (name == null) {
            throw new IllegalArgumentException("Function name cannot be null");
        }
        if (visibility == null || mutability == null) {
            throw new IllegalArgumentException("Function " + name + " needs a visibility and a mutability");
        }
        parameterTypes = parameterTypes == null ? List.of() : List.copyOf(parameterTypes);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        highLevelCalls = highLevelCalls == null ? List.of() : List.copyOf(highLevelCalls);
    }

    /**
     * Name with parameter types, e.g. {@code echidna_check(uint256,address)}.
     */
    public String fullName() {
        return name + "(" + String.join(",", parameterTypes) + ")";
    }

    /**
     * Outgoing calls in {@code Contract.function} form, in analyzer order.
     */
    public List<String> qualifiedCalls() {
        return highLevelCalls.stream()
                .map(HighLevelCall::qualifiedName)
                .toList();
    }

    public List<CfgNode> nodesOfKind(NodeKind kind) {
        return nodes.stream()
                .filter(n -> n.kind() == kind)
                .toList();
    }
}
