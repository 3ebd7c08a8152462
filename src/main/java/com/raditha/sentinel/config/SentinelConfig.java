package com.raditha.sentinel.config;

import com.raditha.sentinel.rule.InvariantRule;

import java.util.List;

/**
 * Effective configuration after merging CLI options, the YAML file and defaults.
 *
 * @param entryPointPrefix    name prefix of fuzz property functions
 * @param entryPointsEnabled  whether the entry point scan runs
 * @param invariants          rules to verify, in file order
 */
public record SentinelConfig(String entryPointPrefix, boolean entryPointsEnabled, List<InvariantRule> invariants) {

    public SentinelConfig {
        if (entryPointPrefix == null || entryPointPrefix.isEmpty()) {
            throw new IllegalArgumentException("entryPointPrefix cannot be empty");
        }
        invariants = invariants == null ? List.of() : List.copyOf(invariants);
    }

    /**
     * Keep only the rules with the given names.
     *
     * @throws IllegalArgumentException if a name matches no rule
     */
    public SentinelConfig selectRules(List<String> names) {
        if (names == null || names.isEmpty()) {
            return this;
        }
        for (String name : names) {
            if (invariants.stream().noneMatch(r -> r.name().equals(name))) {
                throw new IllegalArgumentException("Unknown rule: " + name);
            }
        }
        List<InvariantRule> selected = invariants.stream()
                .filter(r -> names.contains(r.name()))
                .toList();
        return new SentinelConfig(entryPointPrefix, entryPointsEnabled, selected);
    }
}
