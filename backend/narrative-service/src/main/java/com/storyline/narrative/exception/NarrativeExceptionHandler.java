package com.storyline.narrative.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Narrative API 전역 예외 핸들러
 */
@RestControllerAdvice(basePackages = "com.storyline.narrative.controller")
@Slf4j
public class NarrativeExceptionHandler {

    @ExceptionHandler(NarrativeNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NarrativeNotFoundException ex) {
        log.debug("Narrative not found: {}", ex.getNarrativeId());
        return respond(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler({FingerprintValidationException.class, DenyListedEntityException.class})
    public ResponseEntity<Map<String, Object>> handleValidation(NarrativeException ex) {
        log.warn("Narrative validation error: {}", ex.getMessage());
        return respond(ex, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler({NarrativeMergeException.class, DuplicateNarrativeException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(NarrativeException ex) {
        log.warn("Narrative conflict: {}", ex.getMessage());
        return respond(ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(NarrativeException.class)
    public ResponseEntity<Map<String, Object>> handleNarrativeException(NarrativeException ex) {
        log.error("Narrative service error: {}", ex.getMessage(), ex);
        return respond(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        Map<String, Object> response = createErrorResponse(
                "BAD_REQUEST", ex.getMessage(), null, HttpStatus.BAD_REQUEST.value());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        Map<String, Object> response = createErrorResponse(
                "INTERNAL_ERROR",
                "An unexpected error occurred",
                null,
                HttpStatus.INTERNAL_SERVER_ERROR.value()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private ResponseEntity<Map<String, Object>> respond(NarrativeException ex, HttpStatus status) {
        Map<String, Object> response = createErrorResponse(
                ex.getErrorCode(), ex.getMessage(), ex.getNarrativeId(), status.value());
        return ResponseEntity.status(status).body(response);
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, Long narrativeId, int status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status);
        response.put("timestamp", LocalDateTime.now().toString());

        if (narrativeId != null) {
            response.put("narrativeId", narrativeId);
        }

        return response;
    }
}
