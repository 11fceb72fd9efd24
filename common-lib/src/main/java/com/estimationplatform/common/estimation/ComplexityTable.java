package com.estimationplatform.common.estimation;

import com.estimationplatform.common.exception.EstimationConfigurationException;
import com.estimationplatform.common.model.ComplexityTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Base and floor hours per {@link ComplexityTier}.
 *
 * <pre>
 *   tier        base   floor
 *   LOW           28     16
 *   MEDIUM        72     40
 *   HIGH         140     80
 *   VERY_HIGH    240    140
 * </pre>
 * Every tier must be present with a positive base and a non-negative floor; anything else
 * fails construction with {@link EstimationConfigurationException}.
 */
public final class ComplexityTable {

    public record TierHours(double baseHours, double floorHours) {}

    private final Map<ComplexityTier, TierHours> hours;

    public ComplexityTable(Map<ComplexityTier, TierHours> hours) {
        Map<ComplexityTier, TierHours> copy = new EnumMap<>(ComplexityTier.class);
        for (ComplexityTier tier : ComplexityTier.values()) {
            String setting = "estimation.complexity." + tier.name().toLowerCase(Locale.ROOT);
            TierHours entry = hours == null ? null : hours.get(tier);
            if (entry == null) {
                throw new EstimationConfigurationException(setting, "complexity table is missing tier " + tier);
            }
            if (!Double.isFinite(entry.baseHours()) || entry.baseHours() <= 0.0) {
                throw new EstimationConfigurationException(setting + ".base-hours",
                    "base hours must be positive, got " + entry.baseHours());
            }
            if (!Double.isFinite(entry.floorHours()) || entry.floorHours() < 0.0) {
                throw new EstimationConfigurationException(setting + ".floor-hours",
                    "floor hours must be non-negative, got " + entry.floorHours());
            }
            copy.put(tier, entry);
        }
        this.hours = Collections.unmodifiableMap(copy);
    }

    public static ComplexityTable defaults() {
        Map<ComplexityTier, TierHours> table = new EnumMap<>(ComplexityTier.class);
        table.put(ComplexityTier.LOW,       new TierHours(28.0, 16.0));
        table.put(ComplexityTier.MEDIUM,    new TierHours(72.0, 40.0));
        table.put(ComplexityTier.HIGH,      new TierHours(140.0, 80.0));
        table.put(ComplexityTier.VERY_HIGH, new TierHours(240.0, 140.0));
        return new ComplexityTable(table);
    }

    public double baseHours(ComplexityTier tier) {
        return hours.get(tier).baseHours();
    }

    public double floorHours(ComplexityTier tier) {
        return hours.get(tier).floorHours();
    }

    public Map<ComplexityTier, TierHours> asMap() {
        return hours;
    }
}
