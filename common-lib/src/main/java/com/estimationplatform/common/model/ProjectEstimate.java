package com.estimationplatform.common.model;

import java.util.List;
import java.util.Map;

/**
 * Project-level aggregate derived entirely from the {@link FeatureEstimate} list.
 *
 * <p>{@code confidence} is always in [0.0, 0.95]; {@code coverageScore} and
 * {@code strengthScore} are the two inputs it was computed from.
 * {@code categoryTotals} sums final hours per feature category, keys sorted.
 */
public record ProjectEstimate(
    List<FeatureEstimate> features,
    double totalHours,
    double minHours,
    double maxHours,
    double confidence,
    double coverageScore,
    double strengthScore,
    Map<String, Double> categoryTotals
) {
    public static ProjectEstimate empty() {
        return new ProjectEstimate(List.of(), 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, Map.of());
    }
}
