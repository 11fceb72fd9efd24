package com.estimationplatform.common.calibration;

import com.estimationplatform.common.model.CalibrationRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable mapping of normalized label → {@link CalibrationRecord}.
 *
 * <p>Built once by {@link CalibrationStoreBuilder} and never mutated afterwards, so a
 * single instance can be read by any number of concurrent estimation requests.
 * Iteration order is the natural order of the labels.
 */
public final class CalibrationStore {

    private static final CalibrationStore EMPTY = new CalibrationStore(Map.of());

    private final Map<String, CalibrationRecord> records;

    CalibrationStore(Map<String, CalibrationRecord> records) {
        this.records = Collections.unmodifiableMap(new TreeMap<>(records));
    }

    public static CalibrationStore empty() {
        return EMPTY;
    }

    public Optional<CalibrationRecord> get(String normalizedLabel) {
        return Optional.ofNullable(records.get(normalizedLabel));
    }

    public Collection<CalibrationRecord> records() {
        return records.values();
    }

    public Map<String, CalibrationRecord> asMap() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Records usable for blending ({@code sampleCount >= 2}), cheapest first.
     * Ties on average hours fall back to label order.
     */
    public List<CalibrationRecord> historicalSummary() {
        return records.values().stream()
            .filter(CalibrationRecord::usable)
            .sorted(Comparator.comparingDouble(CalibrationRecord::averageHours)
                .thenComparing(CalibrationRecord::normalizedLabel))
            .toList();
    }
}
