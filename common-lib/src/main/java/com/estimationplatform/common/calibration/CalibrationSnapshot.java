package com.estimationplatform.common.calibration;

import java.time.Instant;

/**
 * The unit that gets published on load or reload: a finished store together with the
 * report describing how it was built.
 */
public record CalibrationSnapshot(CalibrationStore store, CalibrationLoadReport report) {

    public static CalibrationSnapshot empty() {
        return new CalibrationSnapshot(CalibrationStore.empty(), CalibrationLoadReport.empty(Instant.EPOCH));
    }
}
