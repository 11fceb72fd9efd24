package com.estimationplatform.common.calibration;

import com.estimationplatform.common.model.CalibrationRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CalibrationStoreBuilderTest {

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("labels normalizing to the same key share one running mean")
        void mergesByNormalizedLabel() {
            CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
            builder.add("User Auth", 50);
            builder.add("user-auth", 70);
            builder.add("AUTH!", 60);

            CalibrationStore store = builder.build();
            CalibrationRecord record = store.get("auth").orElseThrow();
            assertEquals(1, store.size());
            assertEquals(3, record.sampleCount());
            assertEquals(60.0, record.averageHours(), 1e-9);
        }

        @Test
        @DisplayName("row order does not change the resulting records")
        void orderIndependent() {
            List<Double> hours = List.of(12.5, 40.0, 7.25, 90.0, 33.0);

            CalibrationStoreBuilder forward = new CalibrationStoreBuilder();
            hours.forEach(h -> forward.add("Search", h));
            CalibrationStoreBuilder backward = new CalibrationStoreBuilder();
            for (int i = hours.size() - 1; i >= 0; i--) {
                backward.add("search", hours.get(i));
            }

            CalibrationRecord a = forward.build().get("search").orElseThrow();
            CalibrationRecord b = backward.build().get("search").orElseThrow();
            assertEquals(a.sampleCount(), b.sampleCount());
            assertEquals(a.averageHours(), b.averageHours(), 1e-9);
            assertEquals(36.55, a.averageHours(), 1e-9);
        }
    }

    @Nested
    @DisplayName("rejected observations")
    class Rejected {

        @Test
        @DisplayName("non-positive or non-finite hours are not stored")
        void badHours() {
            CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
            assertFalse(builder.add("Chat", 0));
            assertFalse(builder.add("Chat", -5));
            assertFalse(builder.add("Chat", Double.NaN));
            assertFalse(builder.add("Chat", Double.POSITIVE_INFINITY));
            assertTrue(builder.build().isEmpty());
        }

        @Test
        @DisplayName("labels that normalize to empty are not stored")
        void emptyLabel() {
            CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
            assertFalse(builder.add("User Management", 40));
            assertFalse(builder.add(null, 40));
            assertEquals(0, builder.size());
        }
    }

    @Test
    @DisplayName("historicalSummary() lists usable records only, cheapest first")
    void historicalSummary() {
        CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
        builder.add("Payments", 120);
        builder.add("Payments", 100);
        builder.add("Login", 30);
        builder.add("Login", 40);
        builder.add("Chat", 60);          // single sample, not usable

        List<CalibrationRecord> summary = builder.build().historicalSummary();
        assertEquals(2, summary.size());
        assertEquals("login", summary.get(0).normalizedLabel());
        assertEquals("payments", summary.get(1).normalizedLabel());
    }

    @Test
    @DisplayName("a built store is not affected by later additions to the builder")
    void storeIsSnapshot() {
        CalibrationStoreBuilder builder = new CalibrationStoreBuilder();
        builder.add("Login", 30);
        CalibrationStore store = builder.build();
        builder.add("Login", 50);
        builder.add("Search", 20);

        assertEquals(1, store.size());
        assertEquals(1, store.get("login").orElseThrow().sampleCount());
        assertThrows(UnsupportedOperationException.class, () -> store.asMap().clear());
    }
}
