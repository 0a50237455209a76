package com.openrangelabs.nycdata.sync.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for the sync service.
 *
 * <p>Maps registry and request errors to HTTP status codes with a structured body.
 * Ingestion failures never reach this handler; they are reported as sync log statuses.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles unknown dataset ids.
     */
    @ExceptionHandler(DatasetNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDatasetNotFound(
            DatasetNotFoundException ex, ServerWebExchange exchange) {

        log.warn("Dataset not found: {}", ex.getDatasetId());
        return respond(HttpStatus.NOT_FOUND, "Dataset Not Found", ex.getMessage(), exchange);
    }

    /**
     * Handles duplicate dataset registration.
     */
    @ExceptionHandler(DatasetAlreadyExistsException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDatasetAlreadyExists(
            DatasetAlreadyExistsException ex, ServerWebExchange exchange) {

        log.warn("Dataset already exists: {}", ex.getDatasetId());
        return respond(HttpStatus.CONFLICT, "Dataset Already Exists", ex.getMessage(), exchange);
    }

    /**
     * Handles attempts to remove built-in datasets.
     */
    @ExceptionHandler(BuiltInDatasetException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleBuiltInDataset(
            BuiltInDatasetException ex, ServerWebExchange exchange) {

        log.warn("Rejected removal of built-in dataset: {}", ex.getDatasetId());
        return respond(HttpStatus.FORBIDDEN, "Built-in Dataset", ex.getMessage(), exchange);
    }

    /**
     * Handles other dataset configuration errors.
     */
    @ExceptionHandler(DatasetConfigurationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDatasetConfiguration(
            DatasetConfigurationException ex, ServerWebExchange exchange) {

        log.warn("Dataset configuration rejected: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Dataset Configuration", ex.getMessage(), exchange);
    }

    /**
     * Handles source and catalog calls that failed outside an ingestion run.
     */
    @ExceptionHandler(OpenDataSourceException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleOpenDataSource(
            OpenDataSourceException ex, ServerWebExchange exchange) {

        log.warn("Open data source call failed for {}: {}", ex.getDatasetId(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Source Unavailable", ex.getMessage(), exchange);
    }

    /**
     * Handles validation exceptions.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ValidationErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        log.warn("Validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        ValidationErrorResponse error = ValidationErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Request validation failed")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .fieldErrors(fieldErrors)
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    /**
     * Handles malformed query parameters and bodies.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        log.warn("Bad request input: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getReason(), exchange);
    }

    /**
     * Handles access denied exceptions.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(
            AccessDeniedException ex, ServerWebExchange exchange) {

        log.warn("Access denied: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Access Denied",
                "Insufficient privileges to access this resource", exchange);
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again.", exchange);
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(
            HttpStatus status, String error, String message, ServerWebExchange exchange) {

        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();

        return Mono.just(ResponseEntity.status(status).body(body));
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
