package com.estimationplatform.common.estimation;

import com.estimationplatform.common.model.FeatureInput;

import java.util.List;

/**
 * Everything the engine needs for one request, as handed over by the feature-extraction stage.
 *
 * @param features      ordered feature list
 * @param scopeFactor   project-wide multiplier, {@code null} means 1.0
 * @param timelineWeeks declared timeline, {@code null} lets the planner derive one
 */
public record EstimationCommand(
    List<FeatureInput> features,
    Double scopeFactor,
    Double timelineWeeks
) {
    public static EstimationCommand of(List<FeatureInput> features) {
        return new EstimationCommand(features, null, null);
    }

    public double effectiveScopeFactor() {
        return scopeFactor != null ? scopeFactor : EstimationCalculator.DEFAULT_SCOPE_FACTOR;
    }
}
