package com.estimationplatform.estimation.calibration;

import com.estimationplatform.common.calibration.CalibrationSheet;
import com.estimationplatform.common.calibration.DegradedDataWarning;

import java.util.List;

/**
 * Tables read from one file, plus the sheets that had to be skipped.
 */
public record SourceReadResult(
    List<CalibrationSheet> sheets,
    List<DegradedDataWarning> warnings
) {
    public SourceReadResult {
        sheets   = List.copyOf(sheets);
        warnings = List.copyOf(warnings);
    }
}
