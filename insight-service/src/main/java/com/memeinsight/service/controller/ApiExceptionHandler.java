package com.memeinsight.service.controller;

import com.memeinsight.common.exception.ConfigValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

/** Maps rejected input to 400 with the list of violations. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigValidationException.class)
    public ResponseEntity<Map<String, Object>> onInvalidConfig(ConfigValidationException e) {
        log.warn("Rejected configuration change. violations={}", e.getViolations());
        return badRequest(e.getViolations());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> onIllegalArgument(IllegalArgumentException e) {
        log.warn("Rejected request. reason={}", e.getMessage());
        return badRequest(List.of(e.getMessage()));
    }

    private static ResponseEntity<Map<String, Object>> badRequest(List<String> violations) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.<String, Object>of("status", HttpStatus.BAD_REQUEST.value(), "violations", violations));
    }
}
