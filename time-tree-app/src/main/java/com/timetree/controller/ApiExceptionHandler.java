package com.timetree.controller;

import com.timetree.model.TimeTreeException;
import com.timetree.service.TimeTreeService.NodeNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns tree failures into JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TimeTreeException.class)
    public ResponseEntity<Map<String, Object>> handleTreeError(TimeTreeException e) {
        log.warn("Rejected tree request ({}): {}", e.getKind(), e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e.getKind().name(), e.getMessage()));
    }

    @ExceptionHandler(NodeNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNodeNotFound(NodeNotFoundException e) {
        return ResponseEntity.status(404).body(errorBody("NODE_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadArgument(IllegalArgumentException e) {
        log.warn("Rejected tree request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody("BAD_REQUEST", e.getMessage()));
    }

    private Map<String, Object> errorBody(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
