package com.estimationplatform.common.calibration;

/**
 * Row counts for one ingested {@link CalibrationSheet}.
 *
 * @param rejectedReason why the whole sheet was unusable, {@code null} when it was ingested
 */
public record SheetIngestion(
    String source,
    int rowsAccepted,
    int rowsSkipped,
    int rowsUnreadable,
    String rejectedReason
) {
    public static SheetIngestion rejected(String source, String reason) {
        return new SheetIngestion(source, 0, 0, 0, reason);
    }

    public boolean rejected() {
        return rejectedReason != null;
    }
}
