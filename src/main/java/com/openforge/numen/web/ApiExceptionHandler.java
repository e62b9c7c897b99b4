package com.openforge.numen.web;

import com.openforge.numen.error.ConflictException;
import com.openforge.numen.error.ContractValidationException;
import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.error.PersistenceException;
import com.openforge.numen.error.ProviderException;
import com.openforge.numen.error.ProviderTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps the runtime's typed failures onto HTTP statuses:
 *
 *   ContractValidationException, bad input → 400
 *   NotFoundException                      → 404
 *   ConflictException                      → 409
 *   ProviderTimeoutException               → 504
 *   ProviderException                      → 502
 *   PersistenceException, anything else    → 500
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ContractValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(ContractValidationException ex) {
        log.warn("[API] Invalid contract: {}", ex.violations());
        return ResponseEntity.badRequest().body(new ApiErrorResponse(
                400, "validation_error", ex.getMessage(), false, ex.violations()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<String> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(new ApiErrorResponse(
                400, "validation_error", "Invalid request body", false, violations));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), false);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), ex.isRetryable());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiErrorResponse> handleConflict(ConflictException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "conflict", ex.getMessage(), ex.isRetryable());
    }

    @ExceptionHandler(ProviderTimeoutException.class)
    public ResponseEntity<ApiErrorResponse> handleProviderTimeout(ProviderTimeoutException ex) {
        log.error("[API] Provider timeout: {}", ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "provider_timeout", ex.getMessage(), ex.isRetryable());
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ApiErrorResponse> handleProvider(ProviderException ex) {
        log.error("[API] Provider failure: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "provider_error", ex.getMessage(), ex.isRetryable());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ApiErrorResponse> handlePersistence(PersistenceException ex) {
        log.error("[API] Persistence failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "persistence_error", ex.getMessage(), ex.isRetryable());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error", false);
    }

    private static ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String error,
                                                            String message, boolean retryable) {
        return ResponseEntity.status(status).body(ApiErrorResponse.of(status.value(), error, message, retryable));
    }
}
