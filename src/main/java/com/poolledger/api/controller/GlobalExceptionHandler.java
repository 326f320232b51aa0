package com.poolledger.api.controller;

import com.poolledger.common.exception.ErrorCategory;
import com.poolledger.common.exception.PoolLedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PoolLedgerException.class)
    public ResponseEntity<Map<String, String>> handlePoolLedgerException(PoolLedgerException e) {
        HttpStatus status = statusFor(e.getCategory());
        log.info("Rejected request ({}): {}", e.getCategory(), e.getMessage());
        return buildErrorResponse(status, e.getCategory().name(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION.name(),
            "Missing header: " + e.getHeaderName());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL",
            "An unexpected error occurred: " + e.getMessage());
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case VALIDATION, INSUFFICIENT_FUNDS -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RECONCILIATION, REENTRANCY -> HttpStatus.CONFLICT;
            case TRANSPORT -> HttpStatus.BAD_GATEWAY;
        };
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, String category, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        error.put("category", category);
        error.put("status", String.valueOf(status.value()));
        return ResponseEntity.status(status).body(error);
    }
}
