package com.estimationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated historical hours for one normalized feature label.
 *
 * <p>{@code averageHours} is the running mean over {@code sampleCount} source rows.
 * Instances are immutable; merging another observation produces a new record.
 */
public record CalibrationRecord(
    @JsonProperty("normalizedLabel") String normalizedLabel,
    @JsonProperty("sampleCount") int sampleCount,
    @JsonProperty("averageHours") double averageHours
) {
    /** Minimum samples before a record may influence an estimate. */
    public static final int MIN_USABLE_SAMPLES = 2;

    /** Samples at which a record counts as strong evidence for confidence scoring. */
    public static final int STRONG_SAMPLES = 3;

    public static CalibrationRecord first(String normalizedLabel, double hours) {
        return new CalibrationRecord(normalizedLabel, 1, hours);
    }

    /** Running mean update: {@code newAvg = oldAvg + (value - oldAvg) / newCount}. */
    public CalibrationRecord merge(double hours) {
        int newCount = sampleCount + 1;
        double newAvg = averageHours + (hours - averageHours) / newCount;
        return new CalibrationRecord(normalizedLabel, newCount, newAvg);
    }

    public boolean usable() {
        return sampleCount >= MIN_USABLE_SAMPLES;
    }

    public boolean strong() {
        return sampleCount >= STRONG_SAMPLES;
    }
}
