package com.raditha.sentinel.matching;

import com.raditha.sentinel.matching.CandidateRejection.Stage;
import com.raditha.sentinel.model.CfgNode;
import com.raditha.sentinel.model.Function;
import com.raditha.sentinel.model.IrOperation;
import com.raditha.sentinel.model.NodeKind;
import com.raditha.sentinel.model.Variable;
import com.raditha.sentinel.rule.ChildShape;
import com.raditha.sentinel.rule.InvariantRule;
import com.raditha.sentinel.rule.OperationPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Looks for a rule's guarded operation pattern in a function's CFG.
 * <p>
 * Every CONDITIONAL node is a potential guard. A node is a candidate when its first operation is a
 * condition on the named local {@link InvariantRule#guardVariableName()}; a candidate matches when
 * <ol>
 * <li>its children have exactly the expected count and kinds,</li>
 * <li>the designated EXPRESSION child has exactly as many operations as the rule expects
 * (no extra operations interleaved, none missing), and</li>
 * <li>each operation has the shape of the predicate at the same position.</li>
 * </ol>
 * The order in which the function reports its nodes does not affect the verdict: one matching
 * candidate anywhere is enough.
 */
public class PatternMatcher {

    private static final Logger logger = LoggerFactory.getLogger(PatternMatcher.class);

    /**
     * Whether the function contains the rule's structural pattern.
     */
    public boolean matches(Function function, InvariantRule rule) {
        return match(function, rule).matched();
    }

    /**
     * Match and keep the reasons each guard candidate was rejected.
     */
    public MatchReport match(Function function, InvariantRule rule) {
        int conditionalsSeen = 0;
        List<CandidateRejection> rejections = new ArrayList<>();

        for (CfgNode node : function.nodes()) {
            if (node.kind() != NodeKind.CONDITIONAL) {
                continue;
            }
            conditionalsSeen++;
            if (!branchesOn(node, rule.guardVariableName())) {
                continue;
            }

            Optional<CandidateRejection> rejection = checkCandidate(node, rule);
            if (rejection.isEmpty()) {
                logger.debug("Rule {} matched at node {} of {}", rule.name(), node.id(), function.name());
                return new MatchReport(node, conditionalsSeen, rejections);
            }
            logger.debug("Rule {} rejected guard candidate {}", rule.name(), rejection.get());
            rejections.add(rejection.get());
        }
        return new MatchReport(null, conditionalsSeen, rejections);
    }

    /**
     * First operation must be a condition on a named local with exactly this name.
     */
    private static boolean branchesOn(CfgNode node, String guardVariableName) {
        Optional<IrOperation> first = node.firstOperation();
        return first.isPresent()
                && first.get() instanceof IrOperation.Condition condition
                && condition.value() instanceof Variable.NamedLocal local
                && local.name().equals(guardVariableName);
    }

    private static Optional<CandidateRejection> checkCandidate(CfgNode node, InvariantRule rule) {
        ChildShape shape = rule.expectedChildShape();
        List<CfgNode> children = node.children();
        List<NodeKind> childKinds = children.stream()
                .map(CfgNode::kind)
                .toList();
        if (!childKinds.equals(shape.kinds())) {
            return Optional.of(CandidateRejection.of(node, Stage.CHILD_SHAPE,
                    "children " + childKinds + ", expected " + shape.kinds()));
        }

        CfgNode expression = children.get(shape.expressionIndex());
        List<IrOperation> operations = expression.operations();
        List<OperationPredicate> expected = rule.expectedOperationSequence();
        if (operations.size() != expected.size()) {
            return Optional.of(CandidateRejection.of(node, Stage.SEQUENCE_LENGTH,
                    "expression node " + expression.id() + " has " + operations.size()
                            + " operation(s), expected exactly " + expected.size()));
        }

        for (int i = 0; i < expected.size(); i++) {
            OperationShapeMatcher shapeMatcher = new OperationShapeMatcher(expected.get(i), operations.subList(0, i));
            Optional<String> mismatch = operations.get(i).accept(shapeMatcher);
            if (mismatch.isPresent()) {
                return Optional.of(CandidateRejection.of(node, Stage.OPERATION,
                        "operation " + i + " " + mismatch.get()));
            }
        }
        return Optional.empty();
    }
}
