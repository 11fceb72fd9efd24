package com.estimationplatform.common.matching;

import com.estimationplatform.common.calibration.CalibrationStore;
import com.estimationplatform.common.calibration.FeatureNameNormalizer;
import com.estimationplatform.common.model.CalibrationRecord;
import com.estimationplatform.common.model.MatchResult;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Resolves a feature name to the single best {@link CalibrationRecord}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Normalize the input; an empty result is an immediate {@code NONE}.</li>
 *   <li>Walk the strategy chain in order. For each tier, test every stored label.</li>
 *   <li>The first tier with at least one accepted label wins; lower tiers are not consulted.</li>
 *   <li>Within the winning tier: larger {@code sampleCount} first, then the
 *       lexicographically smallest label.</li>
 * </ol>
 *
 * <p>Records with a single sample are returned like any other; callers decide usability
 * via {@link MatchResult#usable()}. Cost is linear in the store size per tier.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class FuzzyFeatureMatcher {

    static final Comparator<CalibrationRecord> TIE_BREAK =
        Comparator.comparingInt(CalibrationRecord::sampleCount).reversed()
            .thenComparing(CalibrationRecord::normalizedLabel);

    private final List<MatchStrategy> chain;

    public FuzzyFeatureMatcher(List<MatchStrategy> chain) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("matcher needs at least one strategy");
        }
        this.chain = List.copyOf(chain);
    }

    /** Exact → contains → token overlap (≥ 0.60). */
    public static FuzzyFeatureMatcher defaultChain() {
        return new FuzzyFeatureMatcher(List.of(
            new ExactMatchStrategy(),
            new ContainsMatchStrategy(),
            new TokenOverlapMatchStrategy()));
    }

    public MatchResult match(String featureName, CalibrationStore store) {
        String input = FeatureNameNormalizer.normalize(featureName);
        if (input.isEmpty() || store.isEmpty()) {
            return MatchResult.none();
        }
        for (MatchStrategy strategy : chain) {
            MatchResult hit = bestInTier(strategy, input, store);
            if (hit != null) {
                return hit;
            }
        }
        return MatchResult.none();
    }

    private static MatchResult bestInTier(MatchStrategy strategy, String input, CalibrationStore store) {
        CalibrationRecord best = null;
        double bestSimilarity = 0.0;
        for (CalibrationRecord candidate : store.records()) {
            OptionalDouble similarity = strategy.similarity(input, candidate.normalizedLabel());
            if (similarity.isEmpty()) continue;
            if (best == null || TIE_BREAK.compare(candidate, best) < 0) {
                best = candidate;
                bestSimilarity = similarity.getAsDouble();
            }
        }
        return best == null ? null : new MatchResult(best, strategy.kind(), bestSimilarity);
    }
}
