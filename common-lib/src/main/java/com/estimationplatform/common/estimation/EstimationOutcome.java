package com.estimationplatform.common.estimation;

import com.estimationplatform.common.model.PlanAllocation;
import com.estimationplatform.common.model.ProjectEstimate;

/** Plain data handed to the proposal stage: the estimate and the plan derived from it. */
public record EstimationOutcome(ProjectEstimate estimate, PlanAllocation plan) {}
