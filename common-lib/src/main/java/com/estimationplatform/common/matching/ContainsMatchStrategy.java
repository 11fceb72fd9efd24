package com.estimationplatform.common.matching;

import com.estimationplatform.common.model.MatchKind;

import java.util.OptionalDouble;

/**
 * Tier 2: one normalized form is a substring of the other.
 *
 * <pre>
 *   similarity = len(shorter) / len(longer)
 * </pre>
 * No minimum similarity; containment alone is the acceptance test.
 */
public final class ContainsMatchStrategy implements MatchStrategy {

    @Override
    public MatchKind kind() {
        return MatchKind.CONTAINS;
    }

    @Override
    public OptionalDouble similarity(String input, String label) {
        if (!input.contains(label) && !label.contains(input)) {
            return OptionalDouble.empty();
        }
        int shorter = Math.min(input.length(), label.length());
        int longer  = Math.max(input.length(), label.length());
        return OptionalDouble.of((double) shorter / longer);
    }
}
