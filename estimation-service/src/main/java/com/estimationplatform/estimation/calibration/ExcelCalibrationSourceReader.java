package com.estimationplatform.estimation.calibration;

import com.estimationplatform.common.calibration.CalibrationSheet;
import com.estimationplatform.common.calibration.DegradedDataWarning;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads {@code .xlsx} / {@code .xls} workbooks with Apache POI, one {@link CalibrationSheet}
 * per worksheet.
 *
 * <p>The first physical row of a sheet is its header. Formula cells contribute their
 * cached result, so nothing is re-evaluated. A sheet that throws while being read is
 * skipped with a warning; the remaining sheets are still returned.
 */
@Component
public class ExcelCalibrationSourceReader implements CalibrationSourceReader {

    private static final Logger log = LoggerFactory.getLogger(ExcelCalibrationSourceReader.class);

    private final DataFormatter formatter = new DataFormatter(Locale.ROOT);

    @Override
    public boolean supports(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xlsx") || name.endsWith(".xls") || name.endsWith(".xlsm");
    }

    @Override
    public SourceReadResult read(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        List<CalibrationSheet> sheets = new ArrayList<>();
        List<DegradedDataWarning> warnings = new ArrayList<>();

        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                String source = fileName + ":" + sheet.getSheetName();
                try {
                    sheets.add(toCalibrationSheet(source, sheet));
                } catch (RuntimeException e) {
                    log.warn("Calibration sheet unreadable, skipping. source={} reason={}", source, e.getMessage());
                    warnings.add(new DegradedDataWarning(source, "sheet unreadable: " + e.getMessage()));
                }
            }
        }
        return new SourceReadResult(sheets, warnings);
    }

    private CalibrationSheet toCalibrationSheet(String source, Sheet sheet) {
        int first = sheet.getFirstRowNum();
        Row headerRow = first >= 0 ? sheet.getRow(first) : null;
        if (headerRow == null) {
            return new CalibrationSheet(source, List.of(), List.of());
        }

        List<String> header = new ArrayList<>();
        for (int c = 0; c < headerRow.getLastCellNum(); c++) {
            Cell cell = headerRow.getCell(c);
            header.add(cell == null ? "" : formatter.formatCellValue(cell).trim());
        }

        List<List<Object>> rows = new ArrayList<>();
        for (int r = first + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) continue;
            List<Object> values = new ArrayList<>(header.size());
            for (int c = 0; c < header.size(); c++) {
                values.add(valueOf(row.getCell(c)));
            }
            rows.add(values);
        }
        return new CalibrationSheet(source, header, rows);
    }

    private static Object valueOf(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA
            ? cell.getCachedFormulaResultType()
            : cell.getCellType();
        return switch (type) {
            case NUMERIC -> cell.getNumericCellValue();
            case STRING  -> cell.getStringCellValue();
            case BOOLEAN -> cell.getBooleanCellValue();
            default      -> null;
        };
    }
}
