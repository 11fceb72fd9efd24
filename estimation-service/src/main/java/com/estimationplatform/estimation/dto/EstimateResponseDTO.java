package com.estimationplatform.estimation.dto;

import com.estimationplatform.common.estimation.EstimationOutcome;
import com.estimationplatform.common.model.ProjectEstimate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response of {@code POST /api/v1/estimation}: plain data for the proposal stage.
 * {@code confidence} is a fraction in [0, 0.95].
 */
public record EstimateResponseDTO(
    String                   traceId,
    List<FeatureEstimateDTO> features,
    double                   totalHours,
    double                   minHours,
    double                   maxHours,
    double                   confidence,
    double                   coverageScore,
    double                   strengthScore,
    Map<String, Double>      categoryTotals,
    PlanDTO                  plan
) {
    public static EstimateResponseDTO from(String traceId, EstimationOutcome outcome) {
        ProjectEstimate estimate = outcome.estimate();
        Map<String, Double> categories = new LinkedHashMap<>();
        estimate.categoryTotals().forEach((category, hours) -> categories.put(category, Rounding.oneDecimal(hours)));
        return new EstimateResponseDTO(
            traceId,
            estimate.features().stream().map(FeatureEstimateDTO::from).toList(),
            estimate.totalHours(),
            Rounding.oneDecimal(estimate.minHours()),
            Rounding.oneDecimal(estimate.maxHours()),
            Rounding.threeDecimals(estimate.confidence()),
            Rounding.threeDecimals(estimate.coverageScore()),
            Rounding.threeDecimals(estimate.strengthScore()),
            categories,
            PlanDTO.from(outcome.plan()));
    }
}
