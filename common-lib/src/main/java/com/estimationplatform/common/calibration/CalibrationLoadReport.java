package com.estimationplatform.common.calibration;

import java.time.Instant;
import java.util.List;

/**
 * Observability summary of one full calibration load.
 *
 * @param sourcesSeen         files offered to the loader
 * @param sourcesContributing files that yielded at least one accepted row
 * @param sheetsRead          tables (CSV files or workbook sheets) that were ingested
 * @param rowsAccepted        rows folded into the store
 * @param rowsSkipped         rows dropped (summary rows, no label, no positive hours, unreadable)
 * @param recordCount         distinct normalized labels in the resulting store
 * @param warnings            degraded-data findings, in discovery order
 * @param loadedAt            completion time of the load
 */
public record CalibrationLoadReport(
    int sourcesSeen,
    int sourcesContributing,
    int sheetsRead,
    int rowsAccepted,
    int rowsSkipped,
    int recordCount,
    List<DegradedDataWarning> warnings,
    Instant loadedAt
) {
    public CalibrationLoadReport {
        warnings = List.copyOf(warnings);
    }

    public static CalibrationLoadReport empty(Instant at) {
        return new CalibrationLoadReport(0, 0, 0, 0, 0, 0, List.of(), at);
    }

    public boolean degraded() {
        return !warnings.isEmpty();
    }
}
