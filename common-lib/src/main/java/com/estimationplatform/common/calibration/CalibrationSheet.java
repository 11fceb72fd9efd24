package com.estimationplatform.common.calibration;

import java.util.List;

/**
 * One header-plus-rows table read from a calibration source (a CSV file or one
 * workbook sheet).
 *
 * <p>Cells hold {@link Number}, {@link String}, {@link Boolean} or {@code null}.
 * Rows may be shorter than the header; missing trailing cells read as {@code null}.
 *
 * @param source human-readable origin, e.g. {@code "estimates.xlsx:Mobile"}
 * @param header raw header cell texts
 * @param rows   data rows below the header
 */
public record CalibrationSheet(
    String source,
    List<String> header,
    List<List<Object>> rows
) {
    public Object cell(List<Object> row, int column) {
        return (column >= 0 && column < row.size()) ? row.get(column) : null;
    }
}
