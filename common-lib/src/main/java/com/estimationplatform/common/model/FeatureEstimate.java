package com.estimationplatform.common.model;

/**
 * Per-feature result of the estimation calculator.
 *
 * @param feature         input as received
 * @param baseHours       complexity-table hours for the feature's tier
 * @param calibratedHours base hours blended with historical evidence (equals base when none is usable)
 * @param finalHours      whole hours after buffer, scope factor and tier floor
 * @param match           matcher outcome, kept for diagnostics and confidence scoring
 */
public record FeatureEstimate(
    FeatureInput feature,
    double baseHours,
    double calibratedHours,
    double finalHours,
    MatchResult match
) {
    public MatchKind matchKind() {
        return match.matchKind();
    }

    public boolean calibrated() {
        return match.usable();
    }
}
