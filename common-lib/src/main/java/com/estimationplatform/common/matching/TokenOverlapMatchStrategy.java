package com.estimationplatform.common.matching;

import com.estimationplatform.common.calibration.FeatureNameNormalizer;
import com.estimationplatform.common.model.MatchKind;

import java.util.HashSet;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Tier 3: Jaccard similarity of the whitespace token sets.
 *
 * <pre>
 *   similarity = |A ∩ B| / |A ∪ B|      accepted when similarity ≥ threshold
 * </pre>
 */
public final class TokenOverlapMatchStrategy implements MatchStrategy {

    public static final double DEFAULT_THRESHOLD = 0.60;

    private final double threshold;

    public TokenOverlapMatchStrategy() {
        this(DEFAULT_THRESHOLD);
    }

    public TokenOverlapMatchStrategy(double threshold) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in (0, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public MatchKind kind() {
        return MatchKind.TOKEN_OVERLAP;
    }

    @Override
    public OptionalDouble similarity(String input, String label) {
        double jaccard = jaccard(FeatureNameNormalizer.tokens(input), FeatureNameNormalizer.tokens(label));
        return jaccard >= threshold ? OptionalDouble.of(jaccard) : OptionalDouble.empty();
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        int intersection = 0;
        for (String token : a) {
            if (b.contains(token)) intersection++;
        }
        return (double) intersection / union.size();
    }
}
