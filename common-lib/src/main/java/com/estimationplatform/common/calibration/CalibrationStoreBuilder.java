package com.estimationplatform.common.calibration;

import com.estimationplatform.common.model.CalibrationRecord;

import java.util.HashMap;
import java.util.Map;

/**
 * Single-use accumulator for a fresh {@link CalibrationStore}.
 *
 * <p>Each observation is folded into its bucket with a running count and running mean,
 * so no raw rows are retained. Not thread-safe; the loader owns one builder per reload
 * and publishes only the finished store.
 */
public final class CalibrationStoreBuilder {

    private final Map<String, CalibrationRecord> records = new HashMap<>();

    /**
     * Adds one historical observation.
     *
     * @param rawLabel feature label as it appears in the source
     * @param hours    observed hours; must be positive and finite
     * @return {@code true} if the observation was folded into a bucket
     */
    public boolean add(String rawLabel, double hours) {
        if (!Double.isFinite(hours) || hours <= 0.0) {
            return false;
        }
        String label = FeatureNameNormalizer.normalize(rawLabel);
        if (label.isEmpty()) {
            return false;
        }
        records.merge(label, CalibrationRecord.first(label, hours),
            (existing, fresh) -> existing.merge(hours));
        return true;
    }

    public int size() {
        return records.size();
    }

    public CalibrationStore build() {
        return new CalibrationStore(records);
    }
}
