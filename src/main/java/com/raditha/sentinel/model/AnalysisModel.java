package com.raditha.sentinel.model;

import java.util.List;

/**
 * Read-only view of an analyzed program.
 * <p>
 * This is the only contract between the verifier and whatever analyzer produced the program
 * model. Implementations must be immutable; nothing in this project writes to a model.
 */
public interface AnalysisModel {

    /**
     * Version of this accessor contract. Bumped whenever a method is added or its meaning changes.
     */
    int ACCESSOR_VERSION = 1;

    /**
     * Version of the accessor contract this model was built against.
     */
    int version();

    /**
     * All contracts in the order the analyzer reported them.
     */
    List<Contract> contracts();

    /**
     * Contracts with exactly this name, in model order. More than one entry means the name is ambiguous.
     */
    default List<Contract> contractsNamed(String name) {
        return contracts().stream()
                .filter(c -> c.name().equals(name))
                .toList();
    }
}
