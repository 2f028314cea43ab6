package com.funnelanalytics.api;

import com.funnelanalytics.domain.exception.InvalidAnalysisRequestException;
import com.funnelanalytics.domain.exception.JobNotFoundException;
import com.funnelanalytics.domain.exception.QueryExecutionException;
import com.funnelanalytics.domain.exception.QueryResourceLimitException;
import com.funnelanalytics.domain.exception.WarehouseUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps analysis failures to {@code {"error": code, "message": text}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidAnalysisRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidAnalysisRequestException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "bad_request", message.isEmpty() ? "Validation failed" : message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "Malformed request body");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleJobNotFound(JobNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(QueryResourceLimitException.class)
    public ResponseEntity<Map<String, Object>> handleResourceLimit(QueryResourceLimitException e) {
        log.warn("Query rejected: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "resource_limit", e.getMessage());
    }

    @ExceptionHandler({
            WarehouseUnavailableException.class,
            DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<Map<String, Object>> handleUnavailable(RuntimeException e) {
        log.error("Warehouse unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "warehouse_unavailable", "Warehouse is unavailable, retry later");
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleQueryExecution(QueryExecutionException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "query_failed", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unhandled error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private String describe(FieldError fieldError) {
        return fieldError.getField() + " " + fieldError.getDefaultMessage();
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
