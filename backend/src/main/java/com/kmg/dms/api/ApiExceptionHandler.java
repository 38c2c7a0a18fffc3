package com.kmg.dms.api;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e,
                                                                     HttpServletRequest request) {
        String message = e.getMessage() == null ? "Bad request" : e.getMessage();
        HttpStatus status = message.contains("not found") ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        log.warn("[{}] {} - {}", request.getMethod(), request.getRequestURI(), message);
        return ResponseEntity.status(status).body(Map.of("error", message));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleIllegalState(IllegalStateException e, HttpServletRequest request) {
        String message = e.getMessage() == null ? "Conflict" : e.getMessage();
        log.warn("[{}] {} - {}", request.getMethod(), request.getRequestURI(), message);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", message));
    }
}
