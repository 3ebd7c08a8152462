package com.raditha.sentinel.scanner;

import java.util.List;

/**
 * Entry points grouped per contract, in model order.
 */
public record EntryPointReport(String prefix, List<ContractEntryPoints> contracts) {

    static final String NONE = "<none>";

    public EntryPointReport {
        contracts = List.copyOf(contracts);
    }

    public boolean isEmpty() {
        return contracts.isEmpty();
    }

    public int functionCount() {
        return contracts.stream()
                .mapToInt(c -> c.functions().size())
                .sum();
    }

    /**
     * Text listing of the discovered entry points.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Echidna property tests:\n");
        if (contracts.isEmpty()) {
            sb.append(NONE).append("\n");
        }
        for (ContractEntryPoints group : contracts) {
            sb.append("\nContract: ").append(group.contractName())
                    .append(" (inherits from: ").append(group.inheritanceDescription()).append(")\n");
            sb.append("Property Tests:\n");
            for (String function : group.functions()) {
                sb.append("\t-").append(function).append("\n");
            }
        }
        sb.append("\n");
        return sb.toString();
    }
}
