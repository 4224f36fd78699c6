package com.temporal.wcc.service.api.advice;

import com.temporal.wcc.service.api.dto.ApiResponse;
import com.temporal.wcc.service.engine.ForestException;
import com.temporal.wcc.service.ingest.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps exceptions to the {@link ApiResponse} envelope and an HTTP status.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", details);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", "VALIDATION_ERROR", details));
    }

    /**
     * Unreadable bodies, including unknown entity types.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", "MALFORMED_REQUEST",
                        ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid parameter {}: {}", ex.getName(), ex.getValue());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Invalid value for parameter " + ex.getName(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(ForestException.class)
    public ResponseEntity<ApiResponse<Void>> handleForestException(ForestException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case "EVENT_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "FEATURES_UNAVAILABLE", "STORE_UNAVAILABLE", "ORACLE_UNAVAILABLE" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "CONCURRENT_MERGE", "TRANSIENT_STORE_ERROR", "STRUCTURAL_VIOLATION" -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        if (status.is5xxServerError()) {
            log.error("Forest error: {} [{}]", ex.getMessage(), ex.getErrorCode(), ex);
        } else {
            log.warn("Forest error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getEntityId(), null));
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ApiResponse<Void>> handleIngestionException(IngestionException ex) {
        log.error("Ingestion error: {} [{}]", ex.getMessage(), ex.getErrorCode());

        HttpStatus status = "QUEUE_FULL".equals(ex.getErrorCode())
                ? HttpStatus.TOO_MANY_REQUESTS
                : HttpStatus.INTERNAL_SERVER_ERROR;

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getEntityId(), null));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR",
                        ex.getMessage()
                ));
    }
}
