package com.estimationplatform.common.model;

/**
 * Outcome of resolving one feature name against the calibration store.
 *
 * @param record     matched record, {@code null} when {@code matchKind == NONE}
 * @param matchKind  tier that produced the hit
 * @param similarity 1.0 for exact, length ratio for contains, Jaccard for token overlap, 0 for none
 */
public record MatchResult(
    CalibrationRecord record,
    MatchKind matchKind,
    double similarity
) {
    private static final MatchResult NONE = new MatchResult(null, MatchKind.NONE, 0.0);

    public static MatchResult none() {
        return NONE;
    }

    /** True when the record may be blended into hours (matched and {@code sampleCount >= 2}). */
    public boolean usable() {
        return record != null && record.usable();
    }

    /** True when the record counts as strong evidence ({@code sampleCount >= 3}). */
    public boolean strong() {
        return record != null && record.strong();
    }

    public int sampleCount() {
        return record != null ? record.sampleCount() : 0;
    }
}
