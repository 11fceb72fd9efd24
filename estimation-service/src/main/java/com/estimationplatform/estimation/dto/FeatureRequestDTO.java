package com.estimationplatform.estimation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One feature as produced by the extraction stage. {@code complexityTier} is the raw tier
 * label ({@code "low"}, {@code "Medium"}, {@code "very_high"}, ...); extraction output
 * that still sends it as {@code complexity} is accepted too.
 */
public record FeatureRequestDTO(
    @JsonProperty("name")                                   String name,
    @JsonProperty("complexityTier") @JsonAlias("complexity") String complexityTier,
    @JsonProperty("category")                               String category
) {}
