package com.estimationplatform.common.matching;

import com.estimationplatform.common.calibration.CalibrationStore;
import com.estimationplatform.common.calibration.CalibrationStoreBuilder;
import com.estimationplatform.common.model.MatchKind;
import com.estimationplatform.common.model.MatchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FuzzyFeatureMatcherTest {

    private final FuzzyFeatureMatcher matcher = FuzzyFeatureMatcher.defaultChain();

    private static CalibrationStore storeOf(Object... labelAndSamples) {
        CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
        for (int i = 0; i < labelAndSamples.length; i += 2) {
            String label = (String) labelAndSamples[i];
            int samples = (Integer) labelAndSamples[i + 1];
            for (int s = 0; s < samples; s++) {
                builder.add(label, 10.0 * (s + 1));
            }
        }
        return builder.build();
    }

    private final CalibrationStore store = storeOf(
        "User Auth", 5,
        "Payment Gateway", 2,
        "Push Notifications", 3,
        "Chat", 1);

    // ── tiers ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("match tiers")
    class Tiers {

        @Test
        @DisplayName("identical normalized label → EXACT with similarity 1.0")
        void exact() {
            MatchResult result = matcher.match("push-notifications", store);
            assertEquals(MatchKind.EXACT, result.matchKind());
            assertEquals("push notifications", result.record().normalizedLabel());
            assertEquals(1.0, result.similarity(), 1e-12);
        }

        @Test
        @DisplayName("substring either way → CONTAINS with length-ratio similarity")
        void contains() {
            MatchResult result = matcher.match("User Authentication", store);
            assertEquals(MatchKind.CONTAINS, result.matchKind());
            assertEquals("auth", result.record().normalizedLabel());
            assertEquals(4.0 / 14.0, result.similarity(), 1e-12);

            MatchResult longer = matcher.match("Payment Gateway Integration", store);
            assertEquals(MatchKind.CONTAINS, longer.matchKind());
            assertEquals("payment gateway", longer.record().normalizedLabel());
        }

        @Test
        @DisplayName("same tokens in another order → TOKEN_OVERLAP")
        void tokenOverlap() {
            MatchResult result = matcher.match("Notifications Push", store);
            assertEquals(MatchKind.TOKEN_OVERLAP, result.matchKind());
            assertEquals(1.0, result.similarity(), 1e-12);
        }

        @Test
        @DisplayName("Jaccard exactly at the 0.60 threshold is accepted, below is not")
        void tokenOverlapThreshold() {
            CalibrationStore tracking = storeOf("Driver Live Map Order Tracking", 2);

            MatchResult atThreshold = matcher.match("Order Tracking Live", tracking);
            assertEquals(MatchKind.TOKEN_OVERLAP, atThreshold.matchKind());
            assertEquals(0.6, atThreshold.similarity(), 1e-12);

            assertEquals(MatchKind.NONE, matcher.match("Tracking Order Eta", tracking).matchKind());
        }

        @Test
        @DisplayName("no tier accepts → NONE with no record")
        void none() {
            MatchResult result = matcher.match("Video Streaming", store);
            assertEquals(MatchKind.NONE, result.matchKind());
            assertNull(result.record());
            assertEquals(0, result.sampleCount());
            assertFalse(result.usable());
        }
    }

    // ── priority and ties ──────────────────────────────────────────────────

    @Nested
    @DisplayName("selection")
    class Selection {

        @Test
        @DisplayName("an exact hit wins over a contains hit with more samples")
        void exactBeatsContains() {
            CalibrationStore reports = storeOf("Reports", 2, "Admin Reports", 5);
            MatchResult result = matcher.match("Reports", reports);
            assertEquals(MatchKind.EXACT, result.matchKind());
            assertEquals(2, result.sampleCount());
        }

        @Test
        @DisplayName("within a tier the record with more samples wins")
        void moreSamplesWins() {
            CalibrationStore search = storeOf("Search", 2, "Filters", 4);
            MatchResult result = matcher.match("Search Filters Panel", search);
            assertEquals(MatchKind.CONTAINS, result.matchKind());
            assertEquals("filters", result.record().normalizedLabel());
        }

        @Test
        @DisplayName("equal sample counts fall back to the smallest label")
        void lexicographicTieBreak() {
            CalibrationStore tied = storeOf("Beta", 2, "Alpha", 2);
            assertEquals("alpha", matcher.match("Alpha Beta", tied).record().normalizedLabel());
        }

        @Test
        @DisplayName("same input and store always produce the same result, whatever the load order")
        void deterministic() {
            CalibrationStore reordered = storeOf(
                "Chat", 1,
                "Push Notifications", 3,
                "Payment Gateway", 2,
                "User Auth", 5);
            for (String name : Set.of("User Authentication", "Notifications Push", "Chat", "Gateway")) {
                MatchResult a = matcher.match(name, store);
                MatchResult b = matcher.match(name, reordered);
                assertEquals(a.matchKind(), b.matchKind(), name);
                assertEquals(a.record().normalizedLabel(), b.record().normalizedLabel(), name);
                assertEquals(a, matcher.match(name, store), name);
            }
        }
    }

    // ── edge cases ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("a name made only of stopwords never matches")
    void stopwordOnlyInput() {
        assertEquals(MatchKind.NONE, matcher.match("User Management", store).matchKind());
    }

    @Test
    @DisplayName("an empty store never matches")
    void emptyStore() {
        assertEquals(MatchResult.none(), matcher.match("User Auth", CalibrationStore.empty()));
    }

    @Test
    @DisplayName("single-sample records are returned but not usable")
    void singleSample() {
        MatchResult result = matcher.match("Chat", store);
        assertEquals(MatchKind.EXACT, result.matchKind());
        assertEquals(1, result.sampleCount());
        assertFalse(result.usable());
    }

    @Test
    @DisplayName("Jaccard of two token sets")
    void jaccard() {
        assertEquals(0.5, TokenOverlapMatchStrategy.jaccard(Set.of("a", "b", "c"), Set.of("b", "c", "d")), 1e-12);
        assertEquals(0.0, TokenOverlapMatchStrategy.jaccard(Set.of(), Set.of()), 1e-12);
    }

    @Test
    @DisplayName("a token threshold outside (0, 1] is refused")
    void badThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new TokenOverlapMatchStrategy(0.0));
        assertThrows(IllegalArgumentException.class, () -> new TokenOverlapMatchStrategy(1.5));
    }
}
