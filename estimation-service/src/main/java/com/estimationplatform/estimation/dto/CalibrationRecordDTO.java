package com.estimationplatform.estimation.dto;

import com.estimationplatform.common.model.CalibrationRecord;

/** One row of {@code GET /api/v1/calibration/summary}. */
public record CalibrationRecordDTO(
    String label,
    double averageHours,
    int    sampleCount
) {
    public static CalibrationRecordDTO from(CalibrationRecord record) {
        return new CalibrationRecordDTO(record.normalizedLabel(),
            Rounding.oneDecimal(record.averageHours()), record.sampleCount());
    }
}
