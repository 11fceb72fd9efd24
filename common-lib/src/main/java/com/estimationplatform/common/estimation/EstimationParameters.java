package com.estimationplatform.common.estimation;

import com.estimationplatform.common.exception.EstimationConfigurationException;

/**
 * Global multipliers of the estimation model.
 *
 * @param bufferMultiplier contingency factor applied to every calibrated estimate (&gt; 1)
 * @param lowBoundRatio    total × ratio = optimistic end of the range (≤ 1)
 * @param highBoundRatio   total × ratio = pessimistic end of the range (≥ 1)
 */
public record EstimationParameters(
    double bufferMultiplier,
    double lowBoundRatio,
    double highBoundRatio
) {
    public static final double DEFAULT_BUFFER_MULTIPLIER = 1.15;
    public static final double DEFAULT_LOW_BOUND_RATIO   = 0.85;
    public static final double DEFAULT_HIGH_BOUND_RATIO  = 1.35;

    public EstimationParameters {
        if (!Double.isFinite(bufferMultiplier) || bufferMultiplier <= 1.0) {
            throw new EstimationConfigurationException("estimation.buffer-multiplier",
                "buffer multiplier must be > 1.0, got " + bufferMultiplier);
        }
        if (!Double.isFinite(lowBoundRatio) || lowBoundRatio <= 0.0 || lowBoundRatio > 1.0) {
            throw new EstimationConfigurationException("estimation.range.low-ratio",
                "low bound ratio must be in (0, 1], got " + lowBoundRatio);
        }
        if (!Double.isFinite(highBoundRatio) || highBoundRatio < 1.0) {
            throw new EstimationConfigurationException("estimation.range.high-ratio",
                "high bound ratio must be >= 1.0, got " + highBoundRatio);
        }
    }

    public static EstimationParameters defaults() {
        return new EstimationParameters(DEFAULT_BUFFER_MULTIPLIER, DEFAULT_LOW_BOUND_RATIO, DEFAULT_HIGH_BOUND_RATIO);
    }
}
