package com.estimationplatform.common.model;

import com.estimationplatform.common.exception.EstimationValidationException;

import java.util.Locale;

/**
 * Complexity bucket assigned to a feature by the upstream extraction stage.
 * Drives the base and floor hours in {@link com.estimationplatform.common.estimation.ComplexityTable}.
 */
public enum ComplexityTier {
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    /**
     * Lenient parse of an upstream label: case-insensitive, and spaces or hyphens are
     * accepted in place of the underscore ({@code "Very High"}, {@code "very-high"}).
     *
     * @param raw   label as received
     * @param field request field the label came from, reported on failure
     * @return the matching tier
     * @throws EstimationValidationException when the label is missing or unknown
     */
    public static ComplexityTier parse(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new EstimationValidationException(field, "complexity tier is required");
        }
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if ("VERYHIGH".equals(key)) {
            return VERY_HIGH;
        }
        for (ComplexityTier tier : values()) {
            if (tier.name().equals(key)) {
                return tier;
            }
        }
        throw new EstimationValidationException(field, "unknown complexity tier '" + raw + "'");
    }
}
