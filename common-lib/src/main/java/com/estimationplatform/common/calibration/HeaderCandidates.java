package com.estimationplatform.common.calibration;

import java.util.List;
import java.util.Locale;

/**
 * Header-name fragments used to locate the label, total-hours and component-hours
 * columns of a calibration table. Matching is case-insensitive "header contains fragment".
 */
public record HeaderCandidates(
    List<String> labelColumns,
    List<String> hoursColumns,
    List<String> componentColumns
) {
    public static HeaderCandidates defaults() {
        return new HeaderCandidates(
            List.of("name", "module name", "feature", "module"),
            List.of("total hours", "total", "hours"),
            List.of("web mobile", "backend", "wireframe", "visual design"));
    }

    public HeaderCandidates {
        labelColumns     = lowered(labelColumns);
        hoursColumns     = lowered(hoursColumns);
        componentColumns = lowered(componentColumns);
    }

    private static List<String> lowered(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(v -> v != null && !v.isBlank())
            .map(v -> v.trim().toLowerCase(Locale.ROOT))
            .toList();
    }
}
