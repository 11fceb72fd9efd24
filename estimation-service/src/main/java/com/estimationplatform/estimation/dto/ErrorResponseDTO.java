package com.estimationplatform.estimation.dto;

/** Error body for rejected requests; {@code field} names the offending input. */
public record ErrorResponseDTO(
    String error,
    String field,
    String message
) {}
