package com.deepansh.feed.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidCursorException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidCursor(InvalidCursorException ex) {
        log.warn("Rejected cursor: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorBody(ex));
    }

    @ExceptionHandler(ExpiredSessionException.class)
    public ResponseEntity<Map<String, Object>> handleExpiredSession(ExpiredSessionException ex) {
        log.info("Feed session expired [sessionId={}]", ex.getSessionId());
        return ResponseEntity.status(HttpStatus.GONE).body(errorBody(ex));
    }

    @ExceptionHandler(FeedException.class)
    public ResponseEntity<Map<String, Object>> handleFeedException(FeedException ex) {
        log.error("Feed error [code={}]: {}", ex.getCode(), ex.getMessage(), ex);
        HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (ex.isRetryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, "1");
        }
        return builder.body(errorBody(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(errorBody("VALIDATION_FAILED", false, msg));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleParameterValidation(HandlerMethodValidationException ex) {
        String msg = ex.getAllValidationResults().stream()
                .flatMap(r -> r.getResolvableErrors().stream())
                .map(e -> e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(errorBody("VALIDATION_FAILED", false, msg));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.badRequest()
                .body(errorBody("MISSING_HEADER", false, "Missing header: " + ex.getHeaderName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("INTERNAL_ERROR", false, "An unexpected error occurred"));
    }

    private Map<String, Object> errorBody(FeedException ex) {
        return errorBody(ex.getCode(), ex.isRetryable(), ex.getMessage());
    }

    private Map<String, Object> errorBody(String code, boolean retryable, String message) {
        return Map.of(
                "error", message,
                "code", code,
                "retryable", retryable,
                "timestamp", Instant.now().toString()
        );
    }
}
