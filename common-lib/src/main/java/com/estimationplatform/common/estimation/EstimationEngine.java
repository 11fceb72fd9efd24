package com.estimationplatform.common.estimation;

import com.estimationplatform.common.calibration.CalibrationStore;
import com.estimationplatform.common.model.PlanAllocation;
import com.estimationplatform.common.model.ProjectEstimate;
import com.estimationplatform.common.planning.ResourcePlanner;

/**
 * Runs the deterministic pipeline for one request:
 * matcher → calculator → confidence scorer → resource planner.
 *
 * <p>Holds no session state; an edited feature list is simply estimated again.
 * Safe to call concurrently as long as each call is given an immutable store.
 */
public final class EstimationEngine {

    private final EstimationCalculator calculator;
    private final ResourcePlanner planner;

    public EstimationEngine(EstimationCalculator calculator, ResourcePlanner planner) {
        this.calculator = calculator;
        this.planner    = planner;
    }

    public EstimationOutcome estimate(EstimationCommand command, CalibrationStore store) {
        ProjectEstimate estimate = calculator.estimate(command.features(), store, command.effectiveScopeFactor());
        PlanAllocation plan = planner.plan(estimate.totalHours(), command.timelineWeeks());
        return new EstimationOutcome(estimate, plan);
    }
}
