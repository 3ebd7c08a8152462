package com.raditha.sentinel.matching;

import com.raditha.sentinel.model.CfgNode;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of matching one function against one rule.
 * <p>
 * Besides the verdict it keeps the near misses: every CONDITIONAL node that branched on the
 * guard variable but failed a later sub-check. Nodes that are not guard candidates at all
 * (other kind, other condition) are only counted.
 *
 * @param matchedNode       the guard node that fully matched, null when none did
 * @param conditionalsSeen  number of CONDITIONAL nodes inspected
 * @param rejections        rejected guard candidates
 */
public record MatchReport(@Nullable CfgNode matchedNode, int conditionalsSeen, List<CandidateRejection> rejections) {

    public MatchReport {
        rejections = List.copyOf(rejections);
    }

    public boolean matched() {
        return matchedNode != null;
    }

    public Optional<CfgNode> match() {
        return Optional.ofNullable(matchedNode);
    }

    /**
     * One line summary of why nothing matched, suitable for a failure message.
     */
    public String describeNearMisses() {
        if (matched()) {
            return "matched at node " + matchedNode.id();
        }
        if (conditionalsSeen == 0) {
            return "no conditional nodes in function";
        }
        if (rejections.isEmpty()) {
            return conditionalsSeen + " conditional node(s) inspected, none branches on the guard variable";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(rejections.size()).append(" candidate guard node(s) found, all rejected: ");
        for (int i = 0; i < rejections.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(rejections.get(i));
        }
        return sb.toString();
    }
}
