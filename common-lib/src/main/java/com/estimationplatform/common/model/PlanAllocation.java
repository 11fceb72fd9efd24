package com.estimationplatform.common.model;

import java.util.Map;

/**
 * Phase split and team recommendation for a project total.
 *
 * @param phaseHours     hours per delivery phase, summing to the project total
 * @param teamCounts     recommended headcount per role
 * @param timelineWeeks  timeline the team was sized for (declared, or defaulted from total hours)
 * @param totalEngineers engineer count before the per-role split
 */
public record PlanAllocation(
    Map<Phase, Double> phaseHours,
    Map<TeamRole, Integer> teamCounts,
    double timelineWeeks,
    int totalEngineers
) {}
