package com.estimationplatform.common.confidence;

/**
 * Output of {@link ConfidenceScorer}.
 *
 * @param coverageScore fraction of features with usable calibration ({@code sampleCount >= 2})
 * @param strengthScore fraction of features with strong calibration ({@code sampleCount >= 3})
 * @param confidence    {@code min(0.95, 0.6 × coverage + 0.4 × strength)}
 */
public record ConfidenceBreakdown(
    double coverageScore,
    double strengthScore,
    double confidence
) {
    public static final ConfidenceBreakdown ZERO = new ConfidenceBreakdown(0.0, 0.0, 0.0);
}
