package com.cargo.monitor.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        String field = fieldOf(e.getMessage());
        if (field != null) {
            body.put("field", field);
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body"));
    }

    // Messages of the form "<field> is required" / "<field> must ..."
    static String fieldOf(String message) {
        if (message == null) {
            return null;
        }
        int space = message.indexOf(' ');
        if (space <= 0) {
            return null;
        }
        String first = message.substring(0, space);
        String rest = message.substring(space + 1);
        if (first.chars().allMatch(Character::isLetterOrDigit)
                && Character.isLowerCase(first.charAt(0))
                && (rest.startsWith("is required") || rest.startsWith("must"))) {
            return first;
        }
        return null;
    }
}
