package com.estimationplatform.common.matching;

import com.estimationplatform.common.model.MatchKind;

import java.util.OptionalDouble;

/**
 * One tier of the fuzzy matching chain.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to share across concurrent requests</li>
 *   <li><b>Pure</b>     : no logging, no side effects</li>
 * </ul>
 * Both arguments are already normalized by
 * {@link com.estimationplatform.common.calibration.FeatureNameNormalizer} and non-empty.
 *
 * <p>Current tiers, in priority order: {@link ExactMatchStrategy},
 * {@link ContainsMatchStrategy}, {@link TokenOverlapMatchStrategy}.
 */
public interface MatchStrategy {

    /** The {@link MatchKind} reported when this tier produces the hit. */
    MatchKind kind();

    /**
     * Tests one stored label against the input.
     *
     * @param input normalized feature name
     * @param label normalized stored label
     * @return similarity in [0, 1] when this tier accepts the pair, empty otherwise
     */
    OptionalDouble similarity(String input, String label);
}
