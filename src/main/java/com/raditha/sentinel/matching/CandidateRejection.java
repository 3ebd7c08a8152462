package com.raditha.sentinel.matching;

import com.raditha.sentinel.model.CfgNode;

/**
 * Why a CONDITIONAL node on the rule's guard variable was not accepted as a match.
 *
 * @param nodeId id of the rejected guard node
 * @param stage  sub-check that rejected it
 * @param reason human readable detail
 */
public record CandidateRejection(int nodeId, Stage stage, String reason) {

    /**
     * Matching stages in the order they are checked.
     */
    public enum Stage {
        CHILD_SHAPE,
        SEQUENCE_LENGTH,
        OPERATION
    }

    static CandidateRejection of(CfgNode node, Stage stage, String reason) {
        return new CandidateRejection(node.id(), stage, reason);
    }

    @Override
    public String toString() {
        return "node " + nodeId + ": " + reason;
    }
}
