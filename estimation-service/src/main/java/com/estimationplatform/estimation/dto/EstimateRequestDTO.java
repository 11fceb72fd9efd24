package com.estimationplatform.estimation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for {@code POST /api/v1/estimation}.
 *
 * @param features      ordered feature list
 * @param scopeFactor   optional reduced-scope multiplier in (0, 1]; 1.0 when omitted
 * @param timelineWeeks optional declared timeline; derived from total hours when omitted
 */
public record EstimateRequestDTO(
    @JsonProperty("features")      List<FeatureRequestDTO> features,
    @JsonProperty("scopeFactor")   Double scopeFactor,
    @JsonProperty("timelineWeeks") Double timelineWeeks
) {}
