package com.raditha.sentinel.scanner;

import java.util.List;

/**
 * Fuzz entry points discovered in one contract.
 *
 * @param contractName  the contract
 * @param immediateBases names of directly inherited contracts
 * @param functions     entry points as {@code Contract.fullName}
 */
public record ContractEntryPoints(String contractName, List<String> immediateBases, List<String> functions) {

    public ContractEntryPoints {
        immediateBases = List.copyOf(immediateBases);
        functions = List.copyOf(functions);
    }

    /**
     * Base names joined with {@code ", "}, or {@code <none>}.
     */
    public String inheritanceDescription() {
        return immediateBases.isEmpty() ? EntryPointReport.NONE : String.join(", ", immediateBases);
    }
}
