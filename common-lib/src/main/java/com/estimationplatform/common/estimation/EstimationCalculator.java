package com.estimationplatform.common.estimation;

import com.estimationplatform.common.calibration.CalibrationStore;
import com.estimationplatform.common.confidence.ConfidenceBreakdown;
import com.estimationplatform.common.confidence.ConfidenceScorer;
import com.estimationplatform.common.exception.EstimationValidationException;
import com.estimationplatform.common.matching.FuzzyFeatureMatcher;
import com.estimationplatform.common.model.FeatureEstimate;
import com.estimationplatform.common.model.FeatureInput;
import com.estimationplatform.common.model.MatchResult;
import com.estimationplatform.common.model.ProjectEstimate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts features into hour estimates and aggregates them into a {@link ProjectEstimate}.
 *
 * <h3>Per feature</h3>
 * <pre>
 *   base       = COMPLEXITY_BASE_HOURS[tier]
 *   calibrated = CalibrationBlend.blend(base, match)      (base when no usable match)
 *   buffered   = calibrated × bufferMultiplier
 *   final      = max(floor[tier], round(buffered × scopeFactor))
 * </pre>
 *
 * <h3>Project</h3>
 * <pre>
 *   total = Σ final
 *   min   = total × lowBoundRatio
 *   max   = total × highBoundRatio
 * </pre>
 *
 * <p>Final hours are whole numbers, so the total is an exact sum. The calculator never
 * touches the store beyond reading it. Stateless and thread-safe.
 */
public final class EstimationCalculator {

    public static final double DEFAULT_SCOPE_FACTOR = 1.0;

    private final ComplexityTable complexityTable;
    private final FuzzyFeatureMatcher matcher;
    private final EstimationParameters parameters;

    public EstimationCalculator(ComplexityTable complexityTable,
                                FuzzyFeatureMatcher matcher,
                                EstimationParameters parameters) {
        this.complexityTable = complexityTable;
        this.matcher         = matcher;
        this.parameters      = parameters;
    }

    /**
     * Estimates every feature and aggregates the project total, range and confidence.
     *
     * @param features    ordered feature list; empty yields {@link ProjectEstimate#empty()}
     * @param store       calibration snapshot to match against
     * @param scopeFactor project-wide multiplier in (0, 1]
     * @throws EstimationValidationException naming the first offending field
     */
    public ProjectEstimate estimate(List<FeatureInput> features, CalibrationStore store, double scopeFactor) {
        validateScopeFactor(scopeFactor);
        if (features == null) {
            throw new EstimationValidationException("features", "feature list is required");
        }
        for (int i = 0; i < features.size(); i++) {
            validateFeature(features.get(i), "features[" + i + "]");
        }
        if (features.isEmpty()) {
            return ProjectEstimate.empty();
        }

        List<FeatureEstimate> estimates = new ArrayList<>(features.size());
        double totalHours = 0.0;
        Map<String, Double> categoryTotals = new TreeMap<>();
        for (FeatureInput feature : features) {
            FeatureEstimate estimate = estimateValidated(feature, store, scopeFactor);
            estimates.add(estimate);
            totalHours += estimate.finalHours();
            categoryTotals.merge(feature.categoryOrDefault(), estimate.finalHours(), Double::sum);
        }

        ConfidenceBreakdown confidence = ConfidenceScorer.score(estimates);

        return new ProjectEstimate(
            Collections.unmodifiableList(estimates),
            totalHours,
            totalHours * parameters.lowBoundRatio(),
            totalHours * parameters.highBoundRatio(),
            confidence.confidence(),
            confidence.coverageScore(),
            confidence.strengthScore(),
            Collections.unmodifiableMap(categoryTotals));
    }

    /** Single-feature estimate, validated with {@code "feature"} as the field prefix. */
    public FeatureEstimate estimateFeature(FeatureInput feature, CalibrationStore store, double scopeFactor) {
        validateScopeFactor(scopeFactor);
        validateFeature(feature, "feature");
        return estimateValidated(feature, store, scopeFactor);
    }

    // ── internals ───────────────────────────────────────────────────────────

    private FeatureEstimate estimateValidated(FeatureInput feature, CalibrationStore store, double scopeFactor) {
        double base  = complexityTable.baseHours(feature.complexityTier());
        double floor = complexityTable.floorHours(feature.complexityTier());

        MatchResult match = matcher.match(feature.name(), store);
        double calibrated = CalibrationBlend.blend(base, match.record());
        double buffered   = calibrated * parameters.bufferMultiplier();
        double finalHours = Math.max(floor, Math.round(buffered * scopeFactor));

        return new FeatureEstimate(feature, base, calibrated, finalHours, match);
    }

    private static void validateScopeFactor(double scopeFactor) {
        if (!Double.isFinite(scopeFactor) || scopeFactor <= 0.0 || scopeFactor > 1.0) {
            throw new EstimationValidationException("scopeFactor",
                "scope factor must be in (0, 1], got " + scopeFactor);
        }
    }

    private static void validateFeature(FeatureInput feature, String field) {
        if (feature == null) {
            throw new EstimationValidationException(field, "feature is required");
        }
        if (feature.name() == null || feature.name().isBlank()) {
            throw new EstimationValidationException(field + ".name", "feature name is required");
        }
        if (feature.complexityTier() == null) {
            throw new EstimationValidationException(field + ".complexityTier", "complexity tier is required");
        }
    }
}
