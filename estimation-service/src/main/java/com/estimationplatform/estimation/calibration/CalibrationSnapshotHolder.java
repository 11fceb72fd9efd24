package com.estimationplatform.estimation.calibration;

import com.estimationplatform.common.calibration.CalibrationSnapshot;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the published {@link CalibrationSnapshot}.
 *
 * <p>Readers call {@link #current()} without locking and always get a fully built snapshot.
 * {@link #reload()} builds a new snapshot off to the side and swaps the reference in one
 * step; reloads are serialized so there is a single writer.
 */
@Component
public class CalibrationSnapshotHolder {

    private static final Logger log = LoggerFactory.getLogger(CalibrationSnapshotHolder.class);

    private final CalibrationLoader loader;
    private final Path folder;
    private final AtomicReference<CalibrationSnapshot> current =
        new AtomicReference<>(CalibrationSnapshot.empty());

    public CalibrationSnapshotHolder(
            CalibrationLoader loader,
            @Value("${estimation.calibration.folder:data/calibration}") String folder) {
        this.loader = loader;
        this.folder = Path.of(folder);
    }

    @PostConstruct
    public void loadOnStartup() {
        reload();
    }

    public CalibrationSnapshot current() {
        return current.get();
    }

    public synchronized CalibrationSnapshot reload() {
        CalibrationSnapshot fresh = loader.loadFolder(folder);
        CalibrationSnapshot previous = current.getAndSet(fresh);
        log.info("CALIBRATION_SWAPPED folder={} previousRecords={} records={} degraded={}",
                 folder, previous.store().size(), fresh.store().size(), fresh.report().degraded());
        return fresh;
    }

    /** {@link #reload()} on a blocking-friendly scheduler, for use from request handlers. */
    public Mono<CalibrationSnapshot> reloadAsync() {
        return Mono.fromCallable(this::reload)
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Path folder() {
        return folder;
    }
}
