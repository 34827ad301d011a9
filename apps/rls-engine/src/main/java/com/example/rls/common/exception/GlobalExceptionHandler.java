package com.example.rls.common.exception;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.exception.PolicyNotFoundException;
import com.example.rls.exception.PolicyValidationException;
import com.example.rls.exception.RlsAccessDeniedException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Provides consistent error responses across all endpoints while
 * preventing sensitive information leakage in error messages.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 160;

    /**
     * Handles policies, roles or configuration rejected at save time.
     *
     * @param ex the exception
     * @return error response listing every violation
     */
    @ExceptionHandler(PolicyValidationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handlePolicyValidation(@NonNull PolicyValidationException ex) {
        LOG.warn("Policy validation failed: {} violations", ex.getViolations().size());

        List<String> details = ex.getViolations().stream()
                .map(this::sanitizeResponseMessage)
                .collect(Collectors.toList());

        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("message", "Policy validation failed");
        response.put("details", details);
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Handles unknown policy, role or template ids.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(PolicyNotFoundException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleNotFound(@NonNull PolicyNotFoundException ex) {
        LOG.debug("{} not found: {}", ex.getResourceType(), StringSanitizer.forLog(ex.getResourceId()));
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of(
                        "error", "not_found",
                        "message", ex.getResourceType() + " not found",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles query rewrites refused by a denying decision.
     *
     * @param ex the exception
     * @return error response carrying the denial reason
     */
    @ExceptionHandler(RlsAccessDeniedException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAccessDenied(@NonNull RlsAccessDeniedException ex) {
        LOG.warn("Access denied: {}", sanitizeForLog(ex.getReason()));
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Map.of(
                        "error", "access_denied",
                        "message", "Access denied",
                        "reason", ex.getReason() != null ? ex.getReason() : "unknown",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles validation errors from @Valid annotated request bodies in WebFlux.
     *
     * @param ex the exception
     * @return error response with field-level details
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleValidationErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", error.getDefaultMessage() != null
                                ? sanitizeResponseMessage(error.getDefaultMessage())
                                : "Invalid value"
                ))
                .collect(Collectors.toList());

        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("message", "Request validation failed");
        response.put("details", fieldErrors);
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Handles constraint violations from @Validated service methods.
     *
     * @param ex the exception
     * @return error response with violation details
     */
    @ExceptionHandler(ConstraintViolationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(@NonNull ConstraintViolationException ex) {
        LOG.warn("Constraint violation: {} violations", ex.getConstraintViolations().size());

        List<Map<String, String>> violations = ex.getConstraintViolations().stream()
                .map(violation -> Map.of(
                        "field", sanitizeFieldName(extractFieldName(violation)),
                        "message", sanitizeResponseMessage(violation.getMessage())
                ))
                .collect(Collectors.toList());

        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("message", "Request validation failed");
        response.put("details", violations);
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Handles malformed request bodies, unknown enum values and custom attributes without a name.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "invalid_request",
                        "message", "Invalid request format",
                        "timestamp", Instant.now().toString()
                ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "invalid_argument",
                        "message", "Invalid request parameter",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles all unhandled exceptions.
     *
     * @param ex the exception
     * @return generic error response
     */
    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of(
                        "error", "internal_error",
                        "message", "An unexpected error occurred",
                        "timestamp", Instant.now().toString()
                ));
    }

    @NonNull
    private String extractFieldName(@NonNull ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @NonNull
    private String sanitizeForLog(@Nullable String value) {
        return StringSanitizer.forLog(value, MAX_LOG_MESSAGE_LENGTH);
    }

    @NonNull
    private String sanitizeFieldName(@Nullable String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return "unknown";
        }
        // Only allow alphanumeric, dot, brackets and underscore
        String cleaned = fieldName.replaceAll("[^a-zA-Z0-9._\\[\\]]", "");
        return cleaned.substring(0, Math.min(cleaned.length(), 80));
    }

    @NonNull
    private String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message
                .replace("\n", " ")
                .replace("\r", " ")
                .replace("\t", " ");

        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
