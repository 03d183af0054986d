package com.leaguebot.api.controller;

import com.leaguebot.api.exception.ResourceNotFoundException;
import com.leaguebot.api.exception.ScheduleStateException;
import com.leaguebot.api.exception.SchedulerNotReadyException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body for URL: {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return body(HttpStatus.BAD_REQUEST, "Malformed request body", request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("Not found: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return body(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(ScheduleStateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ScheduleStateException ex, HttpServletRequest request) {
        log.warn("Conflict: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return body(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(SchedulerNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(SchedulerNotReadyException ex, HttpServletRequest request) {
        log.warn("Unavailable: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse) {
            // framework errors (unsupported method, missing parameter...) keep their own status
            HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
            log.warn("{} for URL: {}: {}", status.value(), request.getRequestURI(), ex.getMessage());
            return body(status, ex.getMessage(), request);
        }
        log.error("Unexpected error for URL: {}", request.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("path", request.getRequestURI());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
