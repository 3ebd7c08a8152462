package com.raditha.sentinel.verifier;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares outgoing calls as multisets: order is ignored, counts are not.
 * <p>
 * Both sides are sorted and diffed; on sorted input the common part of a minimal diff is exactly
 * the multiset intersection, so deleted lines are missing calls and inserted lines are extras.
 */
public class CallSetComparator {

    public CallSetDiff compare(List<String> actualCalls, List<String> expectedCalls) {
        List<String> actual = actualCalls.stream().sorted().toList();
        List<String> expected = expectedCalls.stream().sorted().toList();

        List<String> missing = new ArrayList<>();
        List<String> unexpected = new ArrayList<>();
        if (!actual.equals(expected)) {
            Patch<String> patch = DiffUtils.diff(expected, actual);
            for (AbstractDelta<String> delta : patch.getDeltas()) {
                missing.addAll(delta.getSource().getLines());
                unexpected.addAll(delta.getTarget().getLines());
            }
        }
        return new CallSetDiff(expected, actual, missing.stream().sorted().toList(),
                unexpected.stream().sorted().toList());
    }
}
