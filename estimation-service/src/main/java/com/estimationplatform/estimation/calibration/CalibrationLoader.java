package com.estimationplatform.estimation.calibration;

import com.estimationplatform.common.calibration.CalibrationLoadReport;
import com.estimationplatform.common.calibration.CalibrationSheet;
import com.estimationplatform.common.calibration.CalibrationSheetIngestor;
import com.estimationplatform.common.calibration.CalibrationSnapshot;
import com.estimationplatform.common.calibration.CalibrationStore;
import com.estimationplatform.common.calibration.CalibrationStoreBuilder;
import com.estimationplatform.common.calibration.DegradedDataWarning;
import com.estimationplatform.common.calibration.SheetIngestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Builds a complete {@link CalibrationSnapshot} from calibration files.
 *
 * <p>Every call starts from an empty {@link CalibrationStoreBuilder}; nothing from a
 * previous load is reused. Failures are contained at the narrowest level that still
 * lets the rest load:
 * <ul>
 *   <li>file cannot be opened        → warning, next file</li>
 *   <li>sheet cannot be read/ingested → warning, next sheet</li>
 *   <li>row unusable                  → counted as skipped</li>
 * </ul>
 * An empty result is a valid, degraded snapshot.
 */
@Component
public class CalibrationLoader {

    private static final Logger log = LoggerFactory.getLogger(CalibrationLoader.class);

    private final List<CalibrationSourceReader> readers;
    private final CalibrationSheetIngestor ingestor;

    public CalibrationLoader(List<CalibrationSourceReader> readers, CalibrationSheetIngestor ingestor) {
        this.readers  = readers;
        this.ingestor = ingestor;
    }

    /** Loads every supported file directly inside {@code folder}, in file-name order. */
    public CalibrationSnapshot loadFolder(Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            log.warn("Calibration folder not found, starting with an empty store. folder={}", folder);
            return load(List.of(), List.of(new DegradedDataWarning(String.valueOf(folder),
                "calibration folder not found")));
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing
                .filter(Files::isRegularFile)
                .filter(file -> readerFor(file).isPresent())
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("Calibration folder unreadable, starting with an empty store. folder={}", folder, e);
            return load(List.of(), List.of(new DegradedDataWarning(folder.toString(),
                "calibration folder unreadable: " + e.getMessage())));
        }
        log.info("Calibration sources found. folder={} files={}", folder, files.size());
        return load(files, List.of());
    }

    public CalibrationSnapshot load(List<Path> files) {
        return load(files, List.of());
    }

    private CalibrationSnapshot load(List<Path> files, List<DegradedDataWarning> initialWarnings) {
        CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
        List<DegradedDataWarning> warnings = new ArrayList<>(initialWarnings);
        int sourcesContributing = 0;
        int sheetsRead = 0;
        int rowsAccepted = 0;
        int rowsSkipped = 0;

        for (Path file : files) {
            String source = file.getFileName().toString();
            Optional<CalibrationSourceReader> reader = readerFor(file);
            if (reader.isEmpty()) {
                warnings.add(new DegradedDataWarning(source, "unsupported file type"));
                continue;
            }

            SourceReadResult result;
            try {
                result = reader.get().read(file);
            } catch (IOException | RuntimeException e) {
                log.warn("Calibration source unreadable, skipping. source={} reason={}", source, e.getMessage());
                warnings.add(new DegradedDataWarning(source, "source unreadable: " + e.getMessage()));
                continue;
            }
            warnings.addAll(result.warnings());

            int acceptedFromFile = 0;
            for (CalibrationSheet sheet : result.sheets()) {
                SheetIngestion ingestion = ingestor.ingest(sheet, builder);
                if (ingestion.rejected()) {
                    log.debug("Calibration sheet skipped. source={} reason={}", sheet.source(), ingestion.rejectedReason());
                    warnings.add(new DegradedDataWarning(sheet.source(), ingestion.rejectedReason()));
                    continue;
                }
                sheetsRead++;
                rowsAccepted     += ingestion.rowsAccepted();
                rowsSkipped      += ingestion.rowsSkipped();
                acceptedFromFile += ingestion.rowsAccepted();
                if (ingestion.rowsUnreadable() > 0) {
                    warnings.add(new DegradedDataWarning(sheet.source(),
                        ingestion.rowsUnreadable() + " unreadable row(s) skipped"));
                }
                log.debug("Calibration sheet ingested. source={} accepted={} skipped={}",
                          sheet.source(), ingestion.rowsAccepted(), ingestion.rowsSkipped());
            }
            if (acceptedFromFile > 0) {
                sourcesContributing++;
            }
        }

        CalibrationStore store = builder.build();
        if (store.isEmpty()) {
            warnings.add(new DegradedDataWarning("calibration",
                "no usable calibration records loaded; estimates use complexity base hours only"));
        }

        CalibrationLoadReport report = new CalibrationLoadReport(
            files.size(), sourcesContributing, sheetsRead, rowsAccepted, rowsSkipped,
            store.size(), warnings, Instant.now());

        log.info("CALIBRATION_LOADED records={} usable={} sources={} contributing={} rowsAccepted={} rowsSkipped={} warnings={}",
                 store.size(), store.historicalSummary().size(), files.size(), sourcesContributing,
                 rowsAccepted, rowsSkipped, warnings.size());
        return new CalibrationSnapshot(store, report);
    }

    private Optional<CalibrationSourceReader> readerFor(Path file) {
        return readers.stream().filter(r -> r.supports(file)).findFirst();
    }
}
