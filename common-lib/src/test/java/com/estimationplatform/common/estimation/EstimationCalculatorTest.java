package com.estimationplatform.common.estimation;

import com.estimationplatform.common.calibration.CalibrationStore;
import com.estimationplatform.common.calibration.CalibrationStoreBuilder;
import com.estimationplatform.common.exception.EstimationValidationException;
import com.estimationplatform.common.matching.FuzzyFeatureMatcher;
import com.estimationplatform.common.model.ComplexityTier;
import com.estimationplatform.common.model.FeatureEstimate;
import com.estimationplatform.common.model.FeatureInput;
import com.estimationplatform.common.model.MatchKind;
import com.estimationplatform.common.model.ProjectEstimate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.estimationplatform.common.model.ComplexityTier.*;
import static org.junit.jupiter.api.Assertions.*;

class EstimationCalculatorTest {

    private final EstimationCalculator calculator = new EstimationCalculator(
        ComplexityTable.defaults(), FuzzyFeatureMatcher.defaultChain(), EstimationParameters.defaults());

    private static CalibrationStore authHistory() {
        CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
        for (double hours : new double[]{50, 55, 60, 65, 70}) {
            builder.add("User Auth", hours);
        }
        return builder.build();
    }

    // ── per-feature ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("single feature")
    class SingleFeature {

        @Test
        @DisplayName("no history: medium feature is 72 base, 83 final after the 1.15 buffer")
        void uncalibrated() {
            FeatureEstimate estimate = calculator.estimateFeature(
                FeatureInput.of("User Authentication", MEDIUM), CalibrationStore.empty(), 1.0);

            assertEquals(72.0, estimate.baseHours(), 1e-12);
            assertEquals(72.0, estimate.calibratedHours(), 1e-12);
            assertEquals(83.0, estimate.finalHours(), 1e-12);
            assertEquals(MatchKind.NONE, estimate.matchKind());
            assertFalse(estimate.calibrated());
        }

        @Test
        @DisplayName("five samples averaging 60 pull a medium feature down to 62.4")
        void calibrated() {
            FeatureEstimate estimate = calculator.estimateFeature(
                FeatureInput.of("User Authentication", MEDIUM), authHistory(), 1.0);

            assertEquals(MatchKind.CONTAINS, estimate.matchKind());
            assertTrue(estimate.calibrated());
            assertEquals(62.4, estimate.calibratedHours(), 1e-9);
            assertTrue(estimate.calibratedHours() > 60.0 && estimate.calibratedHours() < 72.0);
            assertEquals(72.0, estimate.finalHours(), 1e-12);
        }

        @Test
        @DisplayName("a single-sample match does not move the estimate")
        void singleSampleIgnored() {
            CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
            builder.add("Chat", 500);
            FeatureEstimate estimate = calculator.estimateFeature(
                FeatureInput.of("Chat", LOW), builder.build(), 1.0);

            assertEquals(MatchKind.EXACT, estimate.matchKind());
            assertEquals(28.0, estimate.calibratedHours(), 1e-12);
            assertEquals(32.0, estimate.finalHours(), 1e-12);
        }

        @Test
        @DisplayName("scope factor scales the buffered hours but never below the tier floor")
        void scopeFactorAndFloor() {
            FeatureInput admin = FeatureInput.of("Admin Dashboard", HIGH);
            CalibrationStore empty = CalibrationStore.empty();

            assertEquals(161.0, calculator.estimateFeature(admin, empty, 1.0).finalHours(), 1e-12);
            assertEquals(81.0,  calculator.estimateFeature(admin, empty, 0.5).finalHours(), 1e-12);
            assertEquals(80.0,  calculator.estimateFeature(admin, empty, 0.3).finalHours(), 1e-12);
            assertEquals(140.0, calculator.estimateFeature(
                FeatureInput.of("Video Calls", VERY_HIGH), empty, 0.1).finalHours(), 1e-12);
        }

        @Test
        @DisplayName("final hours are whole numbers and at least the floor for every tier")
        void wholeHoursAboveFloor() {
            ComplexityTable table = ComplexityTable.defaults();
            for (ComplexityTier tier : ComplexityTier.values()) {
                for (double scope : new double[]{0.05, 0.33, 0.77, 1.0}) {
                    double hours = calculator.estimateFeature(
                        FeatureInput.of("Reports", tier), authHistory(), scope).finalHours();
                    assertEquals(Math.rint(hours), hours, 0.0);
                    assertTrue(hours >= table.floorHours(tier), tier + " @ " + scope);
                }
            }
        }
    }

    // ── project ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("project aggregate")
    class Project {

        @Test
        @DisplayName("total is the sum of final hours and the range brackets it")
        void totalsAndRange() {
            List<FeatureInput> features = List.of(
                FeatureInput.of("User Authentication", MEDIUM),
                FeatureInput.of("Admin Dashboard", HIGH),
                new FeatureInput("Checkout", LOW, "Payments"));

            ProjectEstimate estimate = calculator.estimate(features, authHistory(), 1.0);

            double sum = estimate.features().stream().mapToDouble(FeatureEstimate::finalHours).sum();
            assertEquals(3, estimate.features().size());
            assertEquals(sum, estimate.totalHours(), 1e-9);
            assertEquals(72.0 + 161.0 + 32.0, estimate.totalHours(), 1e-9);
            assertEquals(estimate.totalHours() * 0.85, estimate.minHours(), 1e-9);
            assertEquals(estimate.totalHours() * 1.35, estimate.maxHours(), 1e-9);
            assertTrue(estimate.minHours() <= estimate.totalHours());
            assertTrue(estimate.totalHours() <= estimate.maxHours());
        }

        @Test
        @DisplayName("feature order is preserved and categories are summed")
        void orderAndCategories() {
            List<FeatureInput> features = List.of(
                new FeatureInput("Checkout", LOW, "Payments"),
                FeatureInput.of("Login", LOW),
                new FeatureInput("Refunds", MEDIUM, "Payments"));

            ProjectEstimate estimate = calculator.estimate(features, CalibrationStore.empty(), 1.0);

            assertEquals("Checkout", estimate.features().get(0).feature().name());
            assertEquals("Refunds", estimate.features().get(2).feature().name());
            assertEquals(32.0, estimate.categoryTotals().get("Core"), 1e-9);
            assertEquals(32.0 + 83.0, estimate.categoryTotals().get("Payments"), 1e-9);
        }

        @Test
        @DisplayName("empty feature list → all zeros")
        void empty() {
            ProjectEstimate estimate = calculator.estimate(List.of(), authHistory(), 1.0);
            assertEquals(ProjectEstimate.empty(), estimate);
            assertEquals(0.0, estimate.confidence(), 0.0);
        }

        @Test
        @DisplayName("confidence reflects the share of calibrated features")
        void confidence() {
            ProjectEstimate estimate = calculator.estimate(List.of(
                FeatureInput.of("User Authentication", MEDIUM),
                FeatureInput.of("Video Streaming", HIGH)), authHistory(), 1.0);

            assertEquals(0.5, estimate.coverageScore(), 1e-12);
            assertEquals(0.5, estimate.strengthScore(), 1e-12);
            assertEquals(0.5, estimate.confidence(), 1e-12);
        }
    }

    // ── validation ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("validation")
    class Validation {

        private String fieldOf(Runnable call) {
            return assertThrows(EstimationValidationException.class, call::run).getField();
        }

        @Test
        @DisplayName("scope factor outside (0, 1] is refused")
        void scopeFactor() {
            List<FeatureInput> one = List.of(FeatureInput.of("Login", LOW));
            assertEquals("scopeFactor", fieldOf(() -> calculator.estimate(one, CalibrationStore.empty(), 0.0)));
            assertEquals("scopeFactor", fieldOf(() -> calculator.estimate(one, CalibrationStore.empty(), 1.5)));
            assertEquals("scopeFactor", fieldOf(() -> calculator.estimate(one, CalibrationStore.empty(), Double.NaN)));
        }

        @Test
        @DisplayName("the offending feature is named by index")
        void features() {
            assertEquals("features", fieldOf(() -> calculator.estimate(null, CalibrationStore.empty(), 1.0)));
            assertEquals("features[1].name", fieldOf(() -> calculator.estimate(List.of(
                FeatureInput.of("Login", LOW), FeatureInput.of("  ", LOW)), CalibrationStore.empty(), 1.0)));
            assertEquals("features[0].complexityTier", fieldOf(() -> calculator.estimate(List.of(
                FeatureInput.of("Login", null)), CalibrationStore.empty(), 1.0)));
            assertEquals("features[1]", fieldOf(() -> calculator.estimate(Arrays.asList(
                FeatureInput.of("Login", LOW), null), CalibrationStore.empty(), 1.0)));
        }

        @Test
        @DisplayName("a single feature is reported under the 'feature' prefix")
        void singleFeature() {
            assertEquals("feature.name", fieldOf(() -> calculator.estimateFeature(
                FeatureInput.of(null, LOW), CalibrationStore.empty(), 1.0)));
        }
    }
}
