package com.rollupquery.api;

import com.rollupquery.infrastructure.storage.QueryExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Maps domain failures to HTTP responses. Malformed descriptors are the
 * caller's fault (400); storage failures that survived the raw fallback
 * are reported as a bad gateway (502). A saturated query pool is 503.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleQueryExecution(QueryExecutionException e) {
        log.error("Query execution failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(RejectedExecutionException e) {
        log.warn("Query pool saturated: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Query pool is saturated, retry later");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
