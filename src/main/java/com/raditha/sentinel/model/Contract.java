package com.raditha.sentinel.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A compiled contract: its functions, optional constructor and inheritance.
 * Base contracts are linked by {@link ModelBuilder} after all contracts exist, which then merges in the
 * functions and constructor each contract inherits.
 */
public final class Contract {

    private final String name;
    private final List<Function> declaredFunctions;
    private final @Nullable Function declaredConstructor;
    private List<Function> functions;
    private @Nullable Function constructor;
    private final List<Contract> immediateInheritance = new ArrayList<>();
    private Set<Contract> inheritance = Set.of();

    Contract(String name, List<Function> functions, @Nullable Function constructor) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Contract name cannot be empty");
        }
        this.name = name;
        this.declaredFunctions = List.copyOf(functions);
        this.declaredConstructor = constructor;
        this.functions = declaredFunctions;
        this.constructor = constructor;
    }

    public String name() {
        return name;
    }

    /**
     * Declared functions first, then inherited functions this contract does not override, in
     * inheritance order. The constructor is not included.
     */
    public List<Function> functions() {
        return functions;
    }

    /**
     * Functions declared in this contract only, in declaration order.
     */
    public List<Function> declaredFunctions() {
        return declaredFunctions;
    }

    /**
     * The declared constructor, or else the first one found along the inheritance order.
     */
    public Optional<Function> constructor() {
        return Optional.ofNullable(constructor);
    }

    /**
     * Contracts this one directly inherits from, in declaration order.
     */
    public List<Contract> immediateInheritance() {
        return Collections.unmodifiableList(immediateInheritance);
    }

    /**
     * All contracts this one inherits from at any depth.
     */
    public Set<Contract> inheritance() {
        return inheritance;
    }

    /**
     * First function with exactly this name, if any.
     */
    public Optional<Function> findFunction(String functionName) {
        return functions.stream()
                .filter(f -> f.name().equals(functionName))
                .findFirst();
    }

    void addBase(Contract base) {
        immediateInheritance.add(base);
    }

    /**
     * Compute the transitive inheritance set. Cycles in a malformed model are cut, not followed.
     */
    void closeInheritance() {
        Set<Contract> closure = new LinkedHashSet<>();
        List<Contract> pending = new ArrayList<>(immediateInheritance);
        while (!pending.isEmpty()) {
            Contract next = pending.remove(0);
            if (next != this && closure.add(next)) {
                pending.addAll(next.immediateInheritance);
            }
        }
        inheritance = Collections.unmodifiableSet(closure);
    }

    /**
     * Add the functions and constructor inherited from {@link #inheritance()}. A base function is
     * overridden when this contract, or a base earlier in the order, already has one with the same
     * full name. Requires {@link #closeInheritance()} to have run.
     */
    void inheritMembers() {
        List<Function> merged = new ArrayList<>(declaredFunctions);
        Set<String> seen = new HashSet<>();
        declaredFunctions.forEach(f -> seen.add(f.fullName()));
        Function inheritedConstructor = declaredConstructor;
        for (Contract base : inheritance) {
            for (Function f : base.declaredFunctions) {
                if (seen.add(f.fullName())) {
                    merged.add(f);
                }
            }
            if (inheritedConstructor == null) {
                inheritedConstructor = base.declaredConstructor;
            }
        }
        functions = List.copyOf(merged);
        constructor = inheritedConstructor;
    }

    @Override
    public String toString() {
        return "Contract " + name;
    }
}
