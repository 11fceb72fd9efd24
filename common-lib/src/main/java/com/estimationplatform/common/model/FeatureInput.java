package com.estimationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FeatureInput(
    @JsonProperty("name") String name,
    @JsonProperty("complexityTier") ComplexityTier complexityTier,
    @JsonProperty("category") String category          // optional, grouped as "Core" when absent
) {
    public static final String DEFAULT_CATEGORY = "Core";

    public static FeatureInput of(String name, ComplexityTier tier) {
        return new FeatureInput(name, tier, null);
    }

    public String categoryOrDefault() {
        return (category == null || category.isBlank()) ? DEFAULT_CATEGORY : category.trim();
    }
}
