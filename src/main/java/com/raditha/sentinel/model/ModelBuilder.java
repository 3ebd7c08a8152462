package com.raditha.sentinel.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles an immutable {@link AnalysisModel}.
 * <p>
 * Adapters over a concrete analyzer (see {@code JsonModelReader}) and tests go through this class,
 * so temporaries always come from the model's single {@link TemporaryArena} and node edges are
 * wired before the model is published.
 */
public final class ModelBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ModelBuilder.class);

    private final TemporaryArena arena = new TemporaryArena();
    private final List<ContractBuilder> contracts = new ArrayList<>();
    private boolean built;

    /**
     * Allocate a fresh temporary for an operation result.
     */
    public Variable.Temporary temporary(String type) {
        return arena.allocate(type);
    }

    public ContractBuilder contract(String name) {
        checkNotBuilt();
        ContractBuilder builder = new ContractBuilder(name);
        contracts.add(builder);
        return builder;
    }

    /**
     * Build the model. Base contracts are resolved by name to the first contract carrying it; a base
     * the analyzer did not report becomes an empty external contract so its name is still known.
     * Each contract then receives the functions and constructor it inherits.
     */
    public AnalysisModel build() {
        checkNotBuilt();
        built = true;

        List<Contract> result = new ArrayList<>();
        Map<String, Contract> byName = new LinkedHashMap<>();
        for (ContractBuilder cb : contracts) {
            Contract contract = cb.build();
            result.add(contract);
            byName.putIfAbsent(contract.name(), contract);
        }

        Map<String, Contract> external = new HashMap<>();
        for (int i = 0; i < contracts.size(); i++) {
            Contract contract = result.get(i);
            for (String baseName : contracts.get(i).baseNames) {
                Contract base = byName.get(baseName);
                if (base == null) {
                    logger.debug("Base contract {} of {} is not part of the model", baseName, contract.name());
                    base = external.computeIfAbsent(baseName, n -> new Contract(n, List.of(), null));
                }
                contract.addBase(base);
            }
        }
        result.forEach(Contract::closeInheritance);
        result.forEach(Contract::inheritMembers);

        for (ContractBuilder cb : contracts) {
            cb.freezeNodes();
        }
        logger.debug("Built analysis model with {} contracts and {} temporaries", result.size(), arena.size());
        return new InMemoryAnalysisModel(AnalysisModel.ACCESSOR_VERSION, result);
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Model has already been built");
        }
    }

    /**
     * Collects the functions and base names of one contract.
     */
    public final class ContractBuilder {
        private final String name;
        private final List<String> baseNames = new ArrayList<>();
        private final List<FunctionBuilder> functions = new ArrayList<>();
        private FunctionBuilder constructor;

        private ContractBuilder(String name) {
            this.name = name;
        }

        public ContractBuilder inherits(String... names) {
            baseNames.addAll(Arrays.asList(names));
            return this;
        }

        public FunctionBuilder function(String functionName) {
            checkNotBuilt();
            FunctionBuilder builder = new FunctionBuilder(functionName);
            functions.add(builder);
            return builder;
        }

        /**
         * Declare the constructor with the given parameter types.
         */
        public FunctionBuilder constructor(String... parameterTypes) {
            checkNotBuilt();
            constructor = new FunctionBuilder("constructor").parameters(parameterTypes);
            return constructor;
        }

        private Contract build() {
            List<Function> declared = functions.stream()
                    .map(FunctionBuilder::build)
                    .toList();
            return new Contract(name, declared, constructor == null ? null : constructor.build());
        }

        private void freezeNodes() {
            functions.forEach(FunctionBuilder::freezeNodes);
            if (constructor != null) {
                constructor.freezeNodes();
            }
        }
    }

    /**
     * Collects the signature, CFG and outgoing calls of one function.
     */
    public final class FunctionBuilder {
        private final String name;
        private final List<String> parameterTypes = new ArrayList<>();
        private final Map<Integer, CfgNode> nodes = new LinkedHashMap<>();
        private final List<HighLevelCall> calls = new ArrayList<>();
        private Visibility visibility = Visibility.PUBLIC;
        private Mutability mutability = Mutability.MUTATING;

        private FunctionBuilder(String name) {
            this.name = name;
        }

        public FunctionBuilder parameters(String... types) {
            parameterTypes.addAll(Arrays.asList(types));
            return this;
        }

        public FunctionBuilder visibility(Visibility value) {
            this.visibility = value;
            return this;
        }

        public FunctionBuilder mutability(Mutability value) {
            this.mutability = value;
            return this;
        }

        public FunctionBuilder calls(String contractName, String functionName) {
            calls.add(new HighLevelCall(contractName, functionName));
            return this;
        }

        /**
         * Record an outgoing call given as {@code Contract.function}.
         */
        public FunctionBuilder calls(String qualified) {
            calls.add(HighLevelCall.parse(qualified));
            return this;
        }

        /**
         * Add a node with the next free id.
         */
        public CfgNode node(NodeKind kind, IrOperation... operations) {
            int id = nodes.size();
            while (nodes.containsKey(id)) {
                id++;
            }
            return node(id, kind, Arrays.asList(operations));
        }

        /**
         * Add a node with an analyzer-assigned id.
         *
         * @throws IllegalArgumentException if the id is already taken in this function
         */
        public CfgNode node(int id, NodeKind kind, List<IrOperation> operations) {
            checkNotBuilt();
            if (nodes.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate node id " + id + " in function " + name);
            }
            CfgNode node = new CfgNode(id, kind, operations);
            nodes.put(id, node);
            return node;
        }

        /**
         * Look up a node added earlier by id.
         */
        public CfgNode nodeById(int id) {
            CfgNode node = nodes.get(id);
            if (node == null) {
                throw new IllegalArgumentException("Unknown node id " + id + " in function " + name);
            }
            return node;
        }

        /**
         * Append {@code to} to the children of {@code from}.
         */
        public FunctionBuilder edge(CfgNode from, CfgNode to) {
            if (nodes.get(from.id()) != from || nodes.get(to.id()) != to) {
                throw new IllegalArgumentException("Both ends of an edge must belong to function " + name);
            }
            from.addChild(to);
            return this;
        }

        private Function build() {
            return new Function(name, parameterTypes, visibility, mutability,
                    new ArrayList<>(nodes.values()), calls);
        }

        private void freezeNodes() {
            nodes.values().forEach(CfgNode::freeze);
        }
    }
}
