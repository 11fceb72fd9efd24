package com.estimationplatform.common.confidence;

import com.estimationplatform.common.model.FeatureEstimate;

import java.util.List;

/**
 * Stateless scorer that turns historical evidence coverage into a bounded confidence value.
 *
 * <pre>
 *   coverage   = usable matches / features
 *   strength   = strong matches / features
 *   confidence = min(0.95, coverage × 0.6 + strength × 0.4)
 * </pre>
 *
 * <p>An empty feature list scores exactly 0. The 0.95 cap means a heuristic estimate is
 * never reported as certain.
 */
public final class ConfidenceScorer {

    static final double COVERAGE_WEIGHT = 0.6;
    static final double STRENGTH_WEIGHT = 0.4;
    public static final double MAX_CONFIDENCE = 0.95;

    private ConfidenceScorer() {}

    public static ConfidenceBreakdown score(List<FeatureEstimate> estimates) {
        if (estimates == null || estimates.isEmpty()) {
            return ConfidenceBreakdown.ZERO;
        }
        int total  = estimates.size();
        int usable = 0;
        int strong = 0;
        for (FeatureEstimate estimate : estimates) {
            if (estimate.match().usable()) usable++;
            if (estimate.match().strong()) strong++;
        }

        double coverage = (double) usable / total;
        double strength = (double) strong / total;
        double confidence = Math.min(MAX_CONFIDENCE, coverage * COVERAGE_WEIGHT + strength * STRENGTH_WEIGHT);

        return new ConfidenceBreakdown(coverage, strength, Math.max(0.0, confidence));
    }
}
