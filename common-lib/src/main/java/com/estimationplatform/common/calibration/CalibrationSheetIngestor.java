package com.estimationplatform.common.calibration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folds the rows of one {@link CalibrationSheet} into a {@link CalibrationStoreBuilder}.
 *
 * <h3>Column detection</h3>
 * <ul>
 *   <li>label column: first header containing a {@link HeaderCandidates#labelColumns()} fragment</li>
 *   <li>hours column: first other header containing a {@link HeaderCandidates#hoursColumns()} fragment</li>
 *   <li>component columns: every other header containing a {@link HeaderCandidates#componentColumns()} fragment</li>
 * </ul>
 * A sheet without a label column, or with neither hours nor component columns, is rejected.
 *
 * <h3>Row rules</h3>
 * <ol>
 *   <li>label blank or shorter than two characters → skipped</li>
 *   <li>label containing a total/summary keyword (singular or plural) as a whole word → skipped</li>
 *   <li>hours = hours column when positive, else the sum of component columns</li>
 *   <li>hours not positive → skipped; a cell that holds text but no number counts as unreadable</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class CalibrationSheetIngestor {

    private static final Pattern SUMMARY_ROW = Pattern.compile(
        "\\b(grand[ -]?totals?|sub[ -]?totals?|totals?|summary|summaries)\\b");

    private static final int MIN_LABEL_LENGTH = 2;

    private final HeaderCandidates candidates;

    public CalibrationSheetIngestor(HeaderCandidates candidates) {
        this.candidates = candidates;
    }

    public SheetIngestion ingest(CalibrationSheet sheet, CalibrationStoreBuilder builder) {
        List<String> header = lowered(sheet.header());

        int labelColumn = findFirst(header, candidates.labelColumns(), -1);
        if (labelColumn < 0) {
            return SheetIngestion.rejected(sheet.source(), "no feature label column in header " + sheet.header());
        }
        int hoursColumn = findFirst(header, candidates.hoursColumns(), labelColumn);
        List<Integer> componentColumns = findAll(header, candidates.componentColumns(), labelColumn, hoursColumn);
        if (hoursColumn < 0 && componentColumns.isEmpty()) {
            return SheetIngestion.rejected(sheet.source(), "no hours column in header " + sheet.header());
        }

        int accepted = 0;
        int skipped = 0;
        int unreadable = 0;
        for (List<Object> row : sheet.rows()) {
            String label = labelOf(sheet.cell(row, labelColumn));
            if (label == null || isSummaryRow(label)) {
                skipped++;
                continue;
            }
            HoursReading reading = hoursOf(sheet, row, hoursColumn, componentColumns);
            if (reading.hours() > 0.0 && builder.add(label, reading.hours())) {
                accepted++;
            } else {
                skipped++;
                if (reading.unreadable()) {
                    unreadable++;
                }
            }
        }
        return new SheetIngestion(sheet.source(), accepted, skipped, unreadable, null);
    }

    static boolean isSummaryRow(String label) {
        return SUMMARY_ROW.matcher(label.toLowerCase(Locale.ROOT)).find();
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static String labelOf(Object cell) {
        if (cell == null) {
            return null;
        }
        String text = cell instanceof Double d && d == Math.rint(d)
            ? String.valueOf(d.longValue())
            : cell.toString().trim();
        return text.length() < MIN_LABEL_LENGTH ? null : text;
    }

    private static HoursReading hoursOf(CalibrationSheet sheet, List<Object> row,
                                        int hoursColumn, List<Integer> componentColumns) {
        boolean unreadable = false;
        if (hoursColumn >= 0) {
            Object cell = sheet.cell(row, hoursColumn);
            Double total = numberOf(cell);
            if (total != null && total > 0.0) {
                return new HoursReading(total, false);
            }
            unreadable = total == null && hasText(cell);
        }
        double sum = 0.0;
        for (int column : componentColumns) {
            Object cell = sheet.cell(row, column);
            Double part = numberOf(cell);
            if (part != null) {
                sum += part;
            } else if (hasText(cell)) {
                unreadable = true;
            }
        }
        return new HoursReading(sum, unreadable && sum <= 0.0);
    }

    static Double numberOf(Object cell) {
        if (cell instanceof Number n) {
            double value = n.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        if (cell instanceof String s) {
            String cleaned = s.replace(",", "").trim();
            if (cleaned.isEmpty()) {
                return null;
            }
            try {
                double value = Double.parseDouble(cleaned);
                return Double.isFinite(value) ? value : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean hasText(Object cell) {
        return cell != null && !cell.toString().isBlank();
    }

    private static List<String> lowered(List<String> header) {
        List<String> out = new ArrayList<>(header.size());
        for (String h : header) {
            out.add(h == null ? "" : h.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private static int findFirst(List<String> header, List<String> fragments, int exclude) {
        for (int i = 0; i < header.size(); i++) {
            if (i == exclude) continue;
            if (containsAny(header.get(i), fragments)) {
                return i;
            }
        }
        return -1;
    }

    private static List<Integer> findAll(List<String> header, List<String> fragments, int... exclude) {
        List<Integer> found = new ArrayList<>();
        outer:
        for (int i = 0; i < header.size(); i++) {
            for (int skip : exclude) {
                if (i == skip) continue outer;
            }
            if (containsAny(header.get(i), fragments)) {
                found.add(i);
            }
        }
        return found;
    }

    private static boolean containsAny(String headerCell, List<String> fragments) {
        if (headerCell.isEmpty()) {
            return false;
        }
        for (String fragment : fragments) {
            if (headerCell.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private record HoursReading(double hours, boolean unreadable) {}
}
