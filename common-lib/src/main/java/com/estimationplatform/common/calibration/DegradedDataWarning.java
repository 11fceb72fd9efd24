package com.estimationplatform.common.calibration;

/**
 * Non-fatal calibration problem: a source, sheet or set of rows that could not be used.
 * Recorded in the {@link CalibrationLoadReport}; never thrown.
 */
public record DegradedDataWarning(String source, String reason) {}
