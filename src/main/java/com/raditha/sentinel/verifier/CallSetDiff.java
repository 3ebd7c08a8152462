package com.raditha.sentinel.verifier;

import java.util.List;

/**
 * Multiset difference between the calls a rule expects and the calls a function makes.
 * All lists are sorted.
 *
 * @param expected   expected calls
 * @param actual     actual calls
 * @param missing    expected but not made, one entry per missing occurrence
 * @param unexpected made but not expected, one entry per extra occurrence
 */
public record CallSetDiff(List<String> expected, List<String> actual, List<String> missing, List<String> unexpected) {

    public CallSetDiff {
        expected = List.copyOf(expected);
        actual = List.copyOf(actual);
        missing = List.copyOf(missing);
        unexpected = List.copyOf(unexpected);
    }

    public boolean matches() {
        return missing.isEmpty() && unexpected.isEmpty();
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("actual ").append(actual).append(" vs expected ").append(expected);
        if (!unexpected.isEmpty()) {
            sb.append("; unexpected ").append(unexpected);
        }
        if (!missing.isEmpty()) {
            sb.append("; missing ").append(missing);
        }
        return sb.toString();
    }
}
