package com.raditha.sentinel.model;

import java.util.List;

/**
 * Immutable {@link AnalysisModel} built by {@link ModelBuilder}.
 */
record InMemoryAnalysisModel(int version, List<Contract> contracts) implements AnalysisModel {

    InMemoryAnalysisModel {
        contracts = List.copyOf(contracts);
    }
}
