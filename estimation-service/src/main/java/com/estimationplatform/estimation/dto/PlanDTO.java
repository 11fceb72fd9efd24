package com.estimationplatform.estimation.dto;

import com.estimationplatform.common.model.PlanAllocation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Phase hours keyed by phase key ({@code frontend}, {@code backend}, {@code qa}, {@code pm_ba})
 * and team counts keyed by role display name.
 */
public record PlanDTO(
    Map<String, Double>  phaseHours,
    Map<String, Integer> teamCounts,
    double               timelineWeeks,
    int                  totalEngineers
) {
    public static PlanDTO from(PlanAllocation plan) {
        Map<String, Double> phases = new LinkedHashMap<>();
        plan.phaseHours().forEach((phase, hours) -> phases.put(phase.key(), Rounding.oneDecimal(hours)));
        Map<String, Integer> team = new LinkedHashMap<>();
        plan.teamCounts().forEach((role, count) -> team.put(role.displayName(), count));
        return new PlanDTO(phases, team, Rounding.oneDecimal(plan.timelineWeeks()), plan.totalEngineers());
    }
}
