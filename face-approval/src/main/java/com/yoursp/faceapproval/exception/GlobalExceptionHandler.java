package com.yoursp.faceapproval.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler that produces clean, safe error responses.
 * Stack traces are NEVER exposed in response bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String CORRELATION_ID_KEY = "correlationId";

    /**
     * Rejections raised by the approval flows. Status comes from the error code.
     */
    @ExceptionHandler(ApprovalException.class)
    public ResponseEntity<Map<String, Object>> handleApprovalException(ApprovalException ex) {
        HttpStatus status = ex.getCode().getStatus();
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.debug("Request rejected [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(errorBody(status, ex.getCode().name(), ex.getMessage()));
    }

    /**
     * Handles bean-validation failures (e.g. @Valid on @RequestBody).
     * Returns 400 with a list of field-level errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<Map<String, String>> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> {
                    Map<String, String> error = new HashMap<>();
                    error.put("field", fe.getField());
                    error.put("message", fe.getDefaultMessage());
                    return error;
                })
                .toList();

        Map<String, Object> body = errorBody(HttpStatus.BAD_REQUEST,
                ApprovalErrorCode.INVALID_INPUT.name(), "All fields are required");
        body.put("fieldErrors", fieldErrors);

        log.warn("Validation failed: {} field error(s)", fieldErrors.size());

        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(errorBody(HttpStatus.BAD_REQUEST,
                ApprovalErrorCode.INVALID_INPUT.name(), "Malformed request body"));
    }

    /**
     * Catch-all handler for unhandled exceptions.
     * Returns 500 with correlation ID, never exposes stack traces.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        String correlationId = MDC.get(CORRELATION_ID_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorBody(
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please reference correlationId for support."));
    }

    private Map<String, Object> errorBody(HttpStatus status, String error, String detail) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("detail", detail);
        body.put("correlationId", MDC.get(CORRELATION_ID_KEY));
        return body;
    }
}
