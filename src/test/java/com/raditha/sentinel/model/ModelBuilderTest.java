package com.raditha.sentinel.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelBuilderTest {

    @Test
    void testInheritanceIsLinkedAndClosed() {
        ModelBuilder builder = new ModelBuilder();
        builder.contract("Portal").inherits("Metering", "Semver");
        builder.contract("Metering").inherits("Initializable");
        builder.contract("Semver");

        AnalysisModel model = builder.build();
        Contract portal = model.contractsNamed("Portal").get(0);

        assertEquals(List.of("Metering", "Semver"),
                portal.immediateInheritance().stream().map(Contract::name).toList());
        Set<String> all = Set.copyOf(portal.inheritance().stream().map(Contract::name).toList());
        assertEquals(Set.of("Metering", "Semver", "Initializable"), all);
        assertEquals(3, model.contracts().size(), "External bases are not listed as model contracts");
    }

    @Test
    void testInheritanceCycleIsCut() {
        ModelBuilder builder = new ModelBuilder();
        builder.contract("A").inherits("B");
        builder.contract("B").inherits("A");

        Contract a = builder.build().contractsNamed("A").get(0);

        assertEquals(1, a.inheritance().size());
        assertEquals("B", a.inheritance().iterator().next().name());
    }

    @Test
    void testEdgesAreWiredInOrder() {
        ModelBuilder builder = new ModelBuilder();
        ModelBuilder.FunctionBuilder fn = builder.contract("C").function("f");
        CfgNode guard = fn.node(NodeKind.CONDITIONAL);
        CfgNode body = fn.node(NodeKind.EXPRESSION);
        CfgNode end = fn.node(NodeKind.BLOCK_END);
        fn.edge(guard, body).edge(guard, end);

        builder.build();

        assertEquals(List.of(body, end), guard.children());
        assertThrows(UnsupportedOperationException.class, () -> guard.children().clear());
    }

    @Test
    void testNodesAreFrozenAfterBuild() {
        ModelBuilder builder = new ModelBuilder();
        ModelBuilder.FunctionBuilder fn = builder.contract("C").function("f");
        CfgNode a = fn.node(NodeKind.OTHER);
        CfgNode b = fn.node(NodeKind.OTHER);

        builder.build();

        assertThrows(IllegalStateException.class, () -> fn.edge(a, b));
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testEdgeAcrossFunctionsIsRejected() {
        ModelBuilder builder = new ModelBuilder();
        ModelBuilder.ContractBuilder contract = builder.contract("C");
        ModelBuilder.FunctionBuilder f = contract.function("f");
        ModelBuilder.FunctionBuilder g = contract.function("g");
        CfgNode fromF = f.node(NodeKind.OTHER);
        CfgNode fromG = g.node(NodeKind.OTHER);

        assertThrows(IllegalArgumentException.class, () -> f.edge(fromF, fromG));
    }

    @Test
    void testDuplicateNodeIdIsRejected() {
        ModelBuilder builder = new ModelBuilder();
        ModelBuilder.FunctionBuilder fn = builder.contract("C").function("f");
        fn.node(3, NodeKind.OTHER, List.of());

        assertThrows(IllegalArgumentException.class, () -> fn.node(3, NodeKind.EXPRESSION, List.of()));
    }

    @Test
    void testFunctionSignatureAndCalls() {
        ModelBuilder builder = new ModelBuilder();
        builder.contract("Fuzz").constructor();
        builder.contract("Portal")
                .function("depositTransaction")
                .parameters("address", "uint256")
                .calls("AddressAliasHelper", "applyL1ToL2Alias")
                .calls("AddressAliasHelper.applyL1ToL2Alias");

        AnalysisModel model = builder.build();
        Function deposit = model.contractsNamed("Portal").get(0).findFunction("depositTransaction").orElseThrow();

        assertEquals("depositTransaction(address,uint256)", deposit.fullName());
        assertEquals(List.of("AddressAliasHelper.applyL1ToL2Alias", "AddressAliasHelper.applyL1ToL2Alias"),
                deposit.qualifiedCalls());
        assertTrue(model.contractsNamed("Fuzz").get(0).constructor().isPresent());
        assertTrue(model.contractsNamed("Portal").get(0).constructor().isEmpty());
        assertEquals(AnalysisModel.ACCESSOR_VERSION, model.version());
    }

    @Test
    void testTemporariesAreUniqueAcrossFunctions() {
        ModelBuilder builder = new ModelBuilder();
        Variable.Temporary first = builder.temporary("address");
        Variable.Temporary second = builder.temporary("address");

        assertNotEquals(first.id(), second.id());
        assertFalse(first.isSameValue(second));
        assertTrue(first.isSameValue(first));
    }

    @Test
    void testInheritedFunctionsAndConstructor() {
        ModelBuilder builder = new ModelBuilder();
        ModelBuilder.ContractBuilder base = builder.contract("ResourceMetering");
        base.constructor("uint256");
        base.function("metered").parameters("uint256");
        base.function("params");
        ModelBuilder.ContractBuilder portal = builder.contract("OptimismPortal").inherits("ResourceMetering");
        portal.function("metered").parameters("uint256").mutability(Mutability.VIEW);
        portal.function("metered").parameters("uint64");

        Contract contract = builder.build().contractsNamed("OptimismPortal").get(0);

        assertEquals(List.of("metered(uint256)", "metered(uint64)"),
                contract.declaredFunctions().stream().map(Function::fullName).toList());
        assertEquals(List.of("metered(uint256)", "metered(uint64)", "params()"),
                contract.functions().stream().map(Function::fullName).toList());
        assertEquals(Mutability.VIEW, contract.functions().get(0).mutability());
        assertEquals(List.of("uint256"), contract.constructor().orElseThrow().parameterTypes());
    }

    @Test
    void testDeclaredConstructorWinsOverInherited() {
        ModelBuilder builder = new ModelBuilder();
        builder.contract("Base").constructor("address");
        builder.contract("Child").inherits("Base").constructor();

        Contract child = builder.build().contractsNamed("Child").get(0);

        assertTrue(child.constructor().orElseThrow().parameterTypes().isEmpty());
    }
}
