package com.estimationplatform.estimation.dto;

import com.estimationplatform.common.calibration.CalibrationLoadReport;
import com.estimationplatform.common.calibration.CalibrationSnapshot;
import com.estimationplatform.common.calibration.DegradedDataWarning;

import java.time.Instant;
import java.util.List;

/**
 * Health view of the published calibration snapshot.
 * {@code degraded} is true whenever at least one warning was recorded during the load.
 */
public record CalibrationDiagnosticsDTO(
    String                    folder,
    int                       recordCount,
    int                       usableRecordCount,
    int                       sourcesSeen,
    int                       sourcesContributing,
    int                       sheetsRead,
    int                       rowsAccepted,
    int                       rowsSkipped,
    boolean                   degraded,
    List<DegradedDataWarning> warnings,
    Instant                   loadedAt
) {
    public static CalibrationDiagnosticsDTO from(String folder, CalibrationSnapshot snapshot) {
        CalibrationLoadReport report = snapshot.report();
        return new CalibrationDiagnosticsDTO(
            folder,
            snapshot.store().size(),
            snapshot.store().historicalSummary().size(),
            report.sourcesSeen(),
            report.sourcesContributing(),
            report.sheetsRead(),
            report.rowsAccepted(),
            report.rowsSkipped(),
            report.degraded(),
            report.warnings(),
            report.loadedAt());
    }
}
