package com.estimationplatform.estimation.controller;

import com.estimationplatform.common.exception.EstimationValidationException;
import com.estimationplatform.estimation.dto.ErrorResponseDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps rejected estimation input to HTTP 400 with the offending field.
 * Anything else falls through to the WebFlux default error handling.
 */
@RestControllerAdvice
public class EstimationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(EstimationExceptionHandler.class);

    @ExceptionHandler(EstimationValidationException.class)
    public ResponseEntity<ErrorResponseDTO> handleValidation(EstimationValidationException ex) {
        log.debug("[VALIDATION] field={} - {}", ex.getField(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponseDTO("VALIDATION_ERROR", ex.getField(), ex.getMessage()));
    }
}
