package com.raditha.sentinel.verifier;

import java.util.List;

/**
 * Results of a {@link VerificationSession}, one per rule in run order.
 */
public record SessionReport(List<VerificationResult> results) {

    public SessionReport {
        results = List.copyOf(results);
    }

    public boolean allPassed() {
        return results.stream().allMatch(VerificationResult::passed);
    }

    public List<VerificationResult> failures() {
        return results.stream()
                .filter(r -> !r.passed())
                .toList();
    }

    /**
     * Throw for the first failed rule, if any.
     */
    public void orThrow() {
        results.forEach(VerificationResult::orThrow);
    }

    /**
     * Human readable summary, one block per rule.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        for (VerificationResult result : results) {
            sb.append("Running ").append(result.target()).append(" test (").append(result.ruleName()).append(")...\n");
            for (VerificationWarning warning : result.warnings()) {
                sb.append("  Warning [").append(warning.kind()).append("]: ").append(warning.message()).append("\n");
            }
            if (result.passed()) {
                sb.append("Test passed\n");
            } else {
                VerificationFailure failure = result.failure();
                sb.append("Test FAILED [").append(failure.kind()).append(" / ").append(failure.check()).append("]: ")
                        .append(failure.message()).append("\n");
            }
        }
        sb.append(String.format("%d rule(s) run, %d passed, %d failed%n",
                results.size(), results.size() - failures().size(), failures().size()));
        return sb.toString();
    }
}
