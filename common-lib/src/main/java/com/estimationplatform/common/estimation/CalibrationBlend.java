package com.estimationplatform.common.estimation;

import com.estimationplatform.common.model.CalibrationRecord;

/**
 * Weighted average of complexity-table hours and historical hours.
 *
 * <pre>
 *   w          = min(sampleCount / SAMPLES_FOR_FULL_WEIGHT, MAX_CALIBRATION_WEIGHT)
 *   calibrated = (1 − w) × baseHours + w × averageHours
 * </pre>
 *
 * <pre>
 *   samples   weight
 *     1        0.0   (not usable)
 *     2        0.4
 *     3        0.6
 *     4+       0.8
 * </pre>
 * The table value always keeps at least {@code 1 − MAX_CALIBRATION_WEIGHT} of the result.
 */
public final class CalibrationBlend {

    public static final int    SAMPLES_FOR_FULL_WEIGHT = 5;
    public static final double MAX_CALIBRATION_WEIGHT  = 0.8;

    private CalibrationBlend() {}

    public static double weight(int sampleCount) {
        if (sampleCount < CalibrationRecord.MIN_USABLE_SAMPLES) {
            return 0.0;
        }
        return Math.min((double) sampleCount / SAMPLES_FOR_FULL_WEIGHT, MAX_CALIBRATION_WEIGHT);
    }

    /**
     * @param baseHours complexity-table hours
     * @param record    matched record, may be {@code null}
     * @return blended hours; {@code baseHours} unchanged when the record is missing or not usable
     */
    public static double blend(double baseHours, CalibrationRecord record) {
        if (record == null || !record.usable()) {
            return baseHours;
        }
        double w = weight(record.sampleCount());
        return (1.0 - w) * baseHours + w * record.averageHours();
    }
}
