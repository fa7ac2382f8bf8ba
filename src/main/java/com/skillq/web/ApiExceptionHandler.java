package com.skillq.web;

import com.skillq.error.SkillQException;
import com.skillq.error.ValidationException;
import com.skillq.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Renders errors as {@code {"error": {"code", "message", "details"}}}. Unexpected exceptions are
 * logged and answered with a generic 500.
 */
@RestControllerAdvice(assignableTypes = { JobController.class, WorkerController.class })
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(SkillQException.class)
    public ResponseEntity<ErrorResponse> handleSkillQ(SkillQException e) {
        if (e.getStatusCode() >= 500) {
            log.error("Request failed with {}: {}", e.getCode(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.of(e.getCode(), e.getMessage(), e.getDetails()));
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ValidationException.CODE, "Malformed request", Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error while handling request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(INTERNAL_ERROR, "An unexpected error occurred", Map.of()));
    }
}
