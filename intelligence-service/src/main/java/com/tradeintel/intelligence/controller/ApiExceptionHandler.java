package com.tradeintel.intelligence.controller;

import com.tradeintel.common.exception.InvalidOutcomeException;
import com.tradeintel.common.exception.InvalidOverrideException;
import com.tradeintel.common.exception.RecomputeException;
import com.tradeintel.intelligence.dto.ApiErrorDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps the analytics error taxonomy onto HTTP statuses with an {@link ApiErrorDTO} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidOverrideException.class)
    public ResponseEntity<ApiErrorDTO> invalidOverride(InvalidOverrideException e) {
        log.warn("Override rejected. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(new ApiErrorDTO(e.getErrorKind(), e.getMessage()));
    }

    @ExceptionHandler(InvalidOutcomeException.class)
    public ResponseEntity<ApiErrorDTO> invalidOutcome(InvalidOutcomeException e) {
        return ResponseEntity.badRequest().body(new ApiErrorDTO(e.getErrorKind(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorDTO> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ApiErrorDTO("BAD_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(RecomputeException.class)
    public ResponseEntity<ApiErrorDTO> recomputeFailed(RecomputeException e) {
        log.error("Query could not be answered; refresh failed. kind={} reason={}", e.getKind(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiErrorDTO(e.getErrorKind(), e.getMessage()));
    }
}
