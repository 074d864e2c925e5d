package com.fincube.fraud.exception;

import com.fincube.fraud.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CancellationException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(EvidenceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleEvidenceUnavailable(EvidenceUnavailableException ex) {
        log.warn("Scoring rejected, no evidence: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(ScoringCapacityException.class)
    public ResponseEntity<ErrorResponse> handleScoringCapacity(ScoringCapacityException ex) {
        log.warn("Scoring rejected, pools saturated: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(LedgerUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleLedgerUnavailable(LedgerUnavailableException ex) {
        log.warn("Ledger unavailable: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(DatasetUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDatasetUnavailable(DatasetUnavailableException ex) {
        log.warn("Reference dataset unavailable: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<ErrorResponse> handleCancellation(CancellationException ex) {
        log.info("Request cancelled: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Scoring was cancelled");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status, message));
    }
}
