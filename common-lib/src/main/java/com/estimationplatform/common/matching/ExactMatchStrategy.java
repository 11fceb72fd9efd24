package com.estimationplatform.common.matching;

import com.estimationplatform.common.model.MatchKind;

import java.util.OptionalDouble;

/** Tier 1: normalized forms are identical. Similarity is always 1.0. */
public final class ExactMatchStrategy implements MatchStrategy {

    @Override
    public MatchKind kind() {
        return MatchKind.EXACT;
    }

    @Override
    public OptionalDouble similarity(String input, String label) {
        return input.equals(label) ? OptionalDouble.of(1.0) : OptionalDouble.empty();
    }
}
