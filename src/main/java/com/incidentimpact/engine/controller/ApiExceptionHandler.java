package com.incidentimpact.engine.controller;

import com.incidentimpact.engine.exception.EventIngestionException;
import com.incidentimpact.engine.exception.EventNotFoundException;
import com.incidentimpact.engine.exception.EventStoreUnavailableException;
import com.incidentimpact.engine.exception.RequestValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine exceptions to {@code {status, error, message, timestamp}} bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(RequestValidationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + ": " + f.getDefaultMessage())
            .collect(Collectors.joining("; "));
        log.warn("Rejected request body: {}", message);
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request");
    }

    @ExceptionHandler(EventIngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestion(EventIngestionException e) {
        log.warn("Rejected event: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_EVENT", e.getMessage());
    }

    @ExceptionHandler(EventNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(EventNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(EventStoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(EventStoreUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header("Retry-After", "1")
            .body(body("SERVICE_UNAVAILABLE", e.getMessage()));
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(body(error, message));
    }

    private static Map<String, Object> body(String error, String message) {
        return Map.of(
            "status", "ERROR",
            "error", error,
            "message", message == null ? "" : message,
            "timestamp", Instant.now()
        );
    }
}
