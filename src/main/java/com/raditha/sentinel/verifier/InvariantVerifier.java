package com.raditha.sentinel.verifier;

import com.raditha.sentinel.matching.MatchReport;
import com.raditha.sentinel.matching.PatternMatcher;
import com.raditha.sentinel.model.AnalysisModel;
import com.raditha.sentinel.model.Contract;
import com.raditha.sentinel.model.Function;
import com.raditha.sentinel.rule.InvariantRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Verifies one {@link InvariantRule} against an {@link AnalysisModel}.
 * <p>
 * Checks run in a fixed order and the first failure ends the verification:
 * <ol>
 * <li>locate the contract (first one on a name collision, reported as a warning),</li>
 * <li>locate the function (first one with the exact name),</li>
 * <li>compare the outgoing call multiset,</li>
 * <li>look for the structural pattern.</li>
 * </ol>
 * The model is only read.
 */
public class InvariantVerifier {

    private static final Logger logger = LoggerFactory.getLogger(InvariantVerifier.class);

    private final PatternMatcher matcher;
    private final CallSetComparator callSetComparator;

    public InvariantVerifier() {
        this(new PatternMatcher(), new CallSetComparator());
    }

    public InvariantVerifier(PatternMatcher matcher, CallSetComparator callSetComparator) {
        this.matcher = matcher;
        this.callSetComparator = callSetComparator;
    }

    public VerificationResult verify(AnalysisModel model, InvariantRule rule) {
        String target = rule.qualifiedTarget();
        List<VerificationWarning> warnings = new ArrayList<>();

        List<Contract> candidates = model.contractsNamed(rule.targetContract());
        if (candidates.isEmpty()) {
            return fail(rule, VerificationFailure.contractNotFound(rule.targetContract()), warnings);
        }
        if (candidates.size() > 1) {
            VerificationWarning warning = VerificationWarning.ambiguousContract(rule.targetContract(),
                    candidates.size());
            logger.warn(warning.message());
            warnings.add(warning);
        }
        Contract contract = candidates.get(0);

        Optional<Function> found = contract.findFunction(rule.targetFunction());
        if (found.isEmpty()) {
            return fail(rule, VerificationFailure.functionNotFound(rule.targetContract(), rule.targetFunction()),
                    warnings);
        }
        Function function = found.get();

        CallSetDiff diff = callSetComparator.compare(function.qualifiedCalls(), rule.expectedCalls());
        if (!diff.matches()) {
            return fail(rule, VerificationFailure.callSetMismatch(target, diff), warnings);
        }

        MatchReport report = matcher.match(function, rule);
        if (!report.matched()) {
            return fail(rule, VerificationFailure.structuralPatternNotFound(target, rule.guardVariableName(),
                    report.describeNearMisses()), warnings);
        }

        logger.info("Rule {} holds for {}", rule.name(), target);
        return VerificationResult.pass(rule.name(), target, warnings);
    }

    private static VerificationResult fail(InvariantRule rule, VerificationFailure failure,
            List<VerificationWarning> warnings) {
        logger.info("Rule {} failed the {} check: {}", rule.name(), failure.check(), failure.message());
        return VerificationResult.fail(rule.name(), rule.qualifiedTarget(), failure, warnings);
    }
}
