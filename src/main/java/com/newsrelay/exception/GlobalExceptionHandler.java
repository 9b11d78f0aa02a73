package com.newsrelay.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice(basePackages = "com.newsrelay.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<Map<String, Object>> handleAuthentication(WebhookAuthenticationException ex) {
        log.warn("Webhook authentication failed: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(FeedParseException.class)
    public ResponseEntity<Map<String, Object>> handleFeedParse(FeedParseException ex) {
        log.error("Feed parsing failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(TaskRejectedException ex) {
        log.error("Relay queue full: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "RELAY_BUSY", "Relay is busy, retry later");
    }

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<Map<String, Object>> handleRelay(RelayException ex) {
        log.error("Relay error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String errorCode, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(response);
    }
}
