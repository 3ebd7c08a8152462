package com.raditha.sentinel;

import com.raditha.sentinel.model.AnalysisModel;
import com.raditha.sentinel.model.BinaryOperator;
import com.raditha.sentinel.model.CfgNode;
import com.raditha.sentinel.model.IrOperation;
import com.raditha.sentinel.model.ModelBuilder;
import com.raditha.sentinel.model.Mutability;
import com.raditha.sentinel.model.NodeKind;
import com.raditha.sentinel.model.Variable;
import com.raditha.sentinel.model.Variable.Literal;
import com.raditha.sentinel.model.Variable.NamedLocal;
import com.raditha.sentinel.model.Variable.Temporary;
import com.raditha.sentinel.model.Visibility;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds an OptimismPortal model whose depositTransaction carries the creation check
 * {@code if (_isCreation) require(_to == address(0), ...)}, with knobs to break it in specific ways.
 */
public final class DepositTransactionFixture {

    public static final String REQUIRE_MESSAGE =
            "OptimismPortal: must send to address(0) when creating a contract";

    private BinaryOperator operator = BinaryOperator.EQUAL;
    private String guardName = "_isCreation";
    private String comparedLocal = "_to";
    private boolean extraOperation;
    private boolean freshZeroOperand;
    private boolean guardFirst;
    private String declaringContract;
    private final List<String> extraCalls = new ArrayList<>();
    private final List<NodeKind> extraChildren = new ArrayList<>();

    private DepositTransactionFixture() {
    }

    public static DepositTransactionFixture portal() {
        return new DepositTransactionFixture();
    }

    public static AnalysisModel passing() {
        return portal().build();
    }

    public DepositTransactionFixture operator(BinaryOperator value) {
        this.operator = value;
        return this;
    }

    public DepositTransactionFixture guard(String name) {
        this.guardName = name;
        return this;
    }

    public DepositTransactionFixture comparedLocal(String name) {
        this.comparedLocal = name;
        return this;
    }

    /**
     * Append an unrelated fourth operation to the require expression.
     */
    public DepositTransactionFixture withExtraOperation() {
        this.extraOperation = true;
        return this;
    }

    /**
     * Compare {@code _to} against a zero temporary produced by a different conversion.
     */
    public DepositTransactionFixture withFreshZeroOperand() {
        this.freshZeroOperand = true;
        return this;
    }

    public DepositTransactionFixture withExtraCall(String qualified) {
        extraCalls.add(qualified);
        return this;
    }

    public DepositTransactionFixture withExtraChild(NodeKind kind) {
        extraChildren.add(kind);
        return this;
    }

    /**
     * Report the creation guard before the unrelated conditional instead of after it.
     */
    public DepositTransactionFixture guardFirst() {
        this.guardFirst = true;
        return this;
    }

    /**
     * Declare {@code depositTransaction} in the given base contract and have OptimismPortal inherit it.
     */
    public DepositTransactionFixture inheritedFrom(String baseContract) {
        this.declaringContract = baseContract;
        return this;
    }

    public AnalysisModel build() {
        ModelBuilder builder = new ModelBuilder();
        builder.contract("AddressAliasHelper")
                .function("applyL1ToL2Alias")
                .parameters("address")
                .visibility(Visibility.INTERNAL)
                .mutability(Mutability.PURE);

        ModelBuilder.ContractBuilder portal = builder.contract("OptimismPortal")
                .inherits("Initializable", "ResourceMetering", "Semver");
        ModelBuilder.ContractBuilder owner = portal;
        if (declaringContract != null) {
            portal.inherits(declaringContract);
            owner = builder.contract(declaringContract);
        }
        ModelBuilder.FunctionBuilder deposit = owner
                .function("depositTransaction")
                .parameters("address", "uint256", "uint64", "bool", "bytes")
                .visibility(Visibility.PUBLIC)
                .mutability(Mutability.MUTATING)
                .calls("AddressAliasHelper.applyL1ToL2Alias");
        extraCalls.forEach(deposit::calls);

        Temporary zero = builder.temporary("address");
        Temporary otherZero = builder.temporary("address");
        Temporary comparison = builder.temporary("bool");

        CfgNode entry = deposit.node(NodeKind.OTHER,
                new IrOperation.TypeConversion(new Literal("0", "uint256"), "address", otherZero));

        if (guardFirst) {
            CfgNode guard = addCreationGuard(deposit, zero, otherZero, comparison);
            CfgNode gasCheck = addUnrelatedConditional(builder, deposit);
            deposit.edge(entry, guard).edge(guard, gasCheck);
        } else {
            CfgNode gasCheck = addUnrelatedConditional(builder, deposit);
            CfgNode guard = addCreationGuard(deposit, zero, otherZero, comparison);
            deposit.edge(entry, gasCheck).edge(gasCheck, guard);
        }
        return builder.build();
    }

    private CfgNode addCreationGuard(ModelBuilder.FunctionBuilder deposit, Temporary zero, Temporary otherZero,
            Temporary comparison) {
        CfgNode guard = deposit.node(NodeKind.CONDITIONAL,
                new IrOperation.Condition(new NamedLocal(guardName, "bool")));

        List<IrOperation> operations = new ArrayList<>();
        operations.add(new IrOperation.TypeConversion(new Literal("0", "uint256"), "address", zero));
        Variable right = freshZeroOperand ? otherZero : zero;
        operations.add(new IrOperation.Binary(operator, new NamedLocal(comparedLocal, "address"), right, comparison));
        operations.add(new IrOperation.Call("require(bool,string)",
                List.of(comparison, new Literal(REQUIRE_MESSAGE, "string")), null));
        if (extraOperation) {
            operations.add(new IrOperation.Call("emitLog(string)", List.of(new Literal("creation", "string")), null));
        }
        CfgNode expression = deposit.node(NodeKind.EXPRESSION, operations.toArray(IrOperation[]::new));
        CfgNode end = deposit.node(NodeKind.BLOCK_END);

        deposit.edge(guard, expression).edge(guard, end).edge(expression, end);
        for (NodeKind kind : extraChildren) {
            deposit.edge(guard, deposit.node(kind));
        }
        return guard;
    }

    private static CfgNode addUnrelatedConditional(ModelBuilder builder, ModelBuilder.FunctionBuilder deposit) {
        Temporary tooLow = builder.temporary("bool");
        CfgNode check = deposit.node(NodeKind.CONDITIONAL, new IrOperation.Condition(tooLow));
        CfgNode revert = deposit.node(NodeKind.EXPRESSION,
                new IrOperation.Call("revert(string)", List.of(new Literal("gas limit too low", "string")), null));
        CfgNode end = deposit.node(NodeKind.BLOCK_END);
        deposit.edge(check, revert).edge(check, end);
        return check;
    }
}
