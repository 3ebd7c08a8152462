package com.raditha.sentinel.verifier;

import com.raditha.sentinel.model.AnalysisModel;
import com.raditha.sentinel.rule.InvariantRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs several independent rules against one model. A failing rule does not stop the others.
 */
public class VerificationSession {

    private final InvariantVerifier verifier;

    public VerificationSession() {
        this(new InvariantVerifier());
    }

    public VerificationSession(InvariantVerifier verifier) {
        this.verifier = verifier;
    }

    public SessionReport run(AnalysisModel model, List<InvariantRule> rules) {
        List<VerificationResult> results = new ArrayList<>();
        for (InvariantRule rule : rules) {
            results.add(verifier.verify(model, rule));
        }
        return new SessionReport(results);
    }
}
