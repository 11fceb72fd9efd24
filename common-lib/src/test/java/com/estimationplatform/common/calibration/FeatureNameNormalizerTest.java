package com.estimationplatform.common.calibration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FeatureNameNormalizerTest {

    @Test
    @DisplayName("stopwords are removed after lower-casing")
    void removesStopwords() {
        assertEquals("authentication", FeatureNameNormalizer.normalize("User Authentication"));
        assertEquals("payment checkout", FeatureNameNormalizer.normalize("Payment & Checkout Module"));
    }

    @Test
    @DisplayName("punctuation becomes whitespace and runs collapse")
    void stripsPunctuation() {
        assertEquals("push notifications", FeatureNameNormalizer.normalize("  Push-Notifications!! "));
        assertEquals("oauth2 login", FeatureNameNormalizer.normalize("OAuth2 / Login"));
    }

    @Test
    @DisplayName("a name made only of stopwords normalizes to empty")
    void onlyStopwords() {
        assertEquals("", FeatureNameNormalizer.normalize("User Management System"));
        assertEquals("", FeatureNameNormalizer.normalize("   "));
        assertEquals("", FeatureNameNormalizer.normalize(null));
    }

    @Test
    @DisplayName("normalization is idempotent")
    void idempotent() {
        String once = FeatureNameNormalizer.normalize("The Admin Dashboard (Reports) for Managers");
        assertEquals(once, FeatureNameNormalizer.normalize(once));
        assertEquals("admin dashboard reports managers", once);
    }

    @Test
    @DisplayName("tokens() splits a normalized label, empty label has no tokens")
    void tokens() {
        assertEquals(Set.of("live", "order", "tracking"), FeatureNameNormalizer.tokens("live order tracking"));
        assertTrue(FeatureNameNormalizer.tokens("").isEmpty());
    }
}
