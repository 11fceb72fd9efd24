package com.estimationplatform.common.calibration;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic text transform used as the join key between historical labels and new
 * feature names.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>lower-case (root locale)</li>
 *   <li>every non-alphanumeric character becomes a space</li>
 *   <li>split on whitespace (collapses runs)</li>
 *   <li>drop {@link #STOPWORDS}</li>
 *   <li>re-join with single spaces</li>
 * </ol>
 *
 * <p>Idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.
 */
public final class FeatureNameNormalizer {

    /** Domain-neutral words that carry no signal for matching. */
    public static final Set<String> STOPWORDS = Set.of(
        "user", "management", "system", "module", "service",
        "and", "the", "a", "an", "for", "with", "of", "or", "to", "in"
    );

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private FeatureNameNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = NON_ALPHANUMERIC.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return "";
        }
        return Arrays.stream(cleaned.split("\\s+"))
            .filter(token -> !STOPWORDS.contains(token))
            .collect(Collectors.joining(" "));
    }

    /** Token set of an already-normalized label; empty for an empty label. */
    public static Set<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(normalized.trim().split("\\s+")));
    }
}
