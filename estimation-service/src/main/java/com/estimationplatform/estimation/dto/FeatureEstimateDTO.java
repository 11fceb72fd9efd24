package com.estimationplatform.estimation.dto;

import com.estimationplatform.common.model.FeatureEstimate;
import com.estimationplatform.common.model.MatchResult;

public record FeatureEstimateDTO(
    String  name,
    String  category,
    String  complexityTier,
    double  baseHours,
    double  calibratedHours,
    double  finalHours,
    String  matchKind,
    String  matchedLabel,
    double  similarity,
    int     sampleCount,
    boolean calibrated
) {
    public static FeatureEstimateDTO from(FeatureEstimate estimate) {
        MatchResult match = estimate.match();
        return new FeatureEstimateDTO(
            estimate.feature().name(),
            estimate.feature().categoryOrDefault(),
            estimate.feature().complexityTier().name(),
            Rounding.oneDecimal(estimate.baseHours()),
            Rounding.oneDecimal(estimate.calibratedHours()),
            estimate.finalHours(),
            match.matchKind().name(),
            match.record() != null ? match.record().normalizedLabel() : null,
            Rounding.threeDecimals(match.similarity()),
            match.sampleCount(),
            estimate.calibrated());
    }
}
