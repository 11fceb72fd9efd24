package com.estimationplatform.estimation.dto;

import com.estimationplatform.common.model.MatchResult;

/**
 * Why a single feature name would or would not be calibrated.
 *
 * @param normalizedName the join key the matcher worked with
 * @param usable         whether the match would be blended into an estimate
 */
public record CalibrationLookupDTO(
    String  feature,
    String  normalizedName,
    String  matchKind,
    String  matchedLabel,
    double  similarity,
    int     sampleCount,
    Double  averageHours,
    boolean usable
) {
    public static CalibrationLookupDTO from(String feature, String normalizedName, MatchResult match) {
        return new CalibrationLookupDTO(
            feature,
            normalizedName,
            match.matchKind().name(),
            match.record() != null ? match.record().normalizedLabel() : null,
            Rounding.threeDecimals(match.similarity()),
            match.sampleCount(),
            match.record() != null ? Rounding.oneDecimal(match.record().averageHours()) : null,
            match.usable());
    }
}
