package com.estimationplatform.estimation.calibration;

import com.estimationplatform.common.calibration.CalibrationSheet;
import com.estimationplatform.common.calibration.DegradedDataWarning;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads a {@code .csv} file with Jackson's CSV module as a single {@link CalibrationSheet}.
 *
 * <p>The first record is the header; cells are kept as trimmed strings and parsed as
 * numbers later by the ingestor. A malformed record ends the read early: rows already read
 * are kept and the truncation is reported as a warning.
 */
@Component
public class CsvCalibrationSourceReader implements CalibrationSourceReader {

    private static final Logger log = LoggerFactory.getLogger(CsvCalibrationSourceReader.class);

    private final CsvMapper csvMapper;

    public CsvCalibrationSourceReader(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    @Override
    public SourceReadResult read(Path file) throws IOException {
        String source = file.getFileName().toString();
        List<String> header = null;
        List<List<Object>> rows = new ArrayList<>();
        List<DegradedDataWarning> warnings = new ArrayList<>();

        try (MappingIterator<String[]> records = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(CsvParser.Feature.TRIM_SPACES)
                .readValues(file.toFile())) {
            while (records.hasNextValue()) {
                String[] record = records.nextValue();
                if (header == null) {
                    header = Arrays.asList(record);
                } else {
                    rows.add(new ArrayList<>(Arrays.asList((Object[]) record)));
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("Malformed CSV record, keeping rows read so far. source={} rows={} reason={}",
                     source, rows.size(), e.getMessage());
            warnings.add(new DegradedDataWarning(source,
                "malformed record after " + rows.size() + " rows: " + e.getOriginalMessage()));
        }

        if (header == null) {
            if (warnings.isEmpty()) {
                warnings.add(new DegradedDataWarning(source, "empty file"));
            }
            return new SourceReadResult(List.of(), warnings);
        }
        return new SourceReadResult(List.of(new CalibrationSheet(source, header, rows)), warnings);
    }
}
