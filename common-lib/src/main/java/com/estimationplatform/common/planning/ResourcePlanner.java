package com.estimationplatform.common.planning;

import com.estimationplatform.common.exception.EstimationConfigurationException;
import com.estimationplatform.common.exception.EstimationValidationException;
import com.estimationplatform.common.model.Phase;
import com.estimationplatform.common.model.PlanAllocation;
import com.estimationplatform.common.model.TeamRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Splits a project total into phase hours and a team recommendation.
 *
 * <h3>Phases</h3>
 * <pre>
 *   phaseHours[p] = totalHours × ratio[p]      (default 0.40 / 0.35 / 0.15 / 0.10)
 * </pre>
 * Ratios are checked once, at construction: every phase present, none negative,
 * sum equal to 1.0.
 *
 * <h3>Team</h3>
 * <pre>
 *   weeks      = declared timeline, or max(1, ceil(total / 40))
 *   engineers  = max(2, ceil(total / (weeks × 40)))
 *   frontend   = max(1, ceil(engineers × 0.5))
 *   backend    = max(1, ceil(engineers × 0.5))
 *   qa         = max(1, floor(engineers / 3))
 *   pm         = 1
 * </pre>
 */
public final class ResourcePlanner {

    public static final int HOURS_PER_WEEK = 40;

    static final int    MIN_ENGINEERS    = 2;
    static final double DEV_SHARE        = 0.5;
    static final int    ENGINEERS_PER_QA = 3;
    static final double RATIO_TOLERANCE  = 1e-9;

    private final Map<Phase, Double> ratios;

    public ResourcePlanner(Map<Phase, Double> ratios) {
        this.ratios = validated(ratios);
    }

    public static Map<Phase, Double> defaultRatios() {
        Map<Phase, Double> defaults = new EnumMap<>(Phase.class);
        defaults.put(Phase.FRONTEND, 0.40);
        defaults.put(Phase.BACKEND,  0.35);
        defaults.put(Phase.QA,       0.15);
        defaults.put(Phase.PM_BA,    0.10);
        return defaults;
    }

    public static ResourcePlanner withDefaultRatios() {
        return new ResourcePlanner(defaultRatios());
    }

    /**
     * @param totalHours    project total, finite and non-negative
     * @param timelineWeeks declared timeline, or {@code null} to derive one from the total
     * @throws EstimationValidationException for a negative total or a non-positive timeline
     */
    public PlanAllocation plan(double totalHours, Double timelineWeeks) {
        if (!Double.isFinite(totalHours) || totalHours < 0.0) {
            throw new EstimationValidationException("totalHours",
                "total hours must be finite and non-negative, got " + totalHours);
        }
        if (timelineWeeks != null && (!Double.isFinite(timelineWeeks) || timelineWeeks <= 0.0)) {
            throw new EstimationValidationException("timelineWeeks",
                "timeline must be a positive number of weeks, got " + timelineWeeks);
        }

        Map<Phase, Double> phaseHours = new EnumMap<>(Phase.class);
        for (Map.Entry<Phase, Double> ratio : ratios.entrySet()) {
            phaseHours.put(ratio.getKey(), totalHours * ratio.getValue());
        }

        double weeks = timelineWeeks != null
            ? timelineWeeks
            : Math.max(1.0, Math.ceil(totalHours / HOURS_PER_WEEK));
        int engineers = Math.max(MIN_ENGINEERS, (int) Math.ceil(totalHours / (weeks * HOURS_PER_WEEK)));

        Map<TeamRole, Integer> team = new EnumMap<>(TeamRole.class);
        team.put(TeamRole.FRONTEND_DEVELOPER, Math.max(1, (int) Math.ceil(engineers * DEV_SHARE)));
        team.put(TeamRole.BACKEND_DEVELOPER,  Math.max(1, (int) Math.ceil(engineers * DEV_SHARE)));
        team.put(TeamRole.QA_ENGINEER,        Math.max(1, engineers / ENGINEERS_PER_QA));
        team.put(TeamRole.PROJECT_MANAGER,    1);

        return new PlanAllocation(
            Collections.unmodifiableMap(phaseHours),
            Collections.unmodifiableMap(team),
            weeks,
            engineers);
    }

    public Map<Phase, Double> ratios() {
        return ratios;
    }

    private static Map<Phase, Double> validated(Map<Phase, Double> ratios) {
        Map<Phase, Double> copy = new EnumMap<>(Phase.class);
        double sum = 0.0;
        for (Phase phase : Phase.values()) {
            String setting = "estimation.phase-ratios." + phase.key().replace('_', '-').toLowerCase(Locale.ROOT);
            Double ratio = ratios == null ? null : ratios.get(phase);
            if (ratio == null) {
                throw new EstimationConfigurationException(setting, "phase ratio is missing");
            }
            if (!Double.isFinite(ratio) || ratio < 0.0) {
                throw new EstimationConfigurationException(setting, "phase ratio must be non-negative, got " + ratio);
            }
            copy.put(phase, ratio);
            sum += ratio;
        }
        if (Math.abs(sum - 1.0) > RATIO_TOLERANCE) {
            throw new EstimationConfigurationException("estimation.phase-ratios",
                "phase ratios must sum to 1.0, got " + sum);
        }
        return Collections.unmodifiableMap(copy);
    }
}
