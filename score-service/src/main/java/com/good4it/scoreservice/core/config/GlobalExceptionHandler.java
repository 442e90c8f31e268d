package com.good4it.scoreservice.core.config;

import com.good4it.scoreservice.core.exceptions.InvalidHistoryLimitException;
import com.good4it.scoreservice.core.exceptions.UnknownChangeTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownChangeTypeException.class)
    public ResponseEntity<Object> handleUnknownChangeType(UnknownChangeTypeException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "UNKNOWN_CHANGE_TYPE", ex.getMessage());
    }

    @ExceptionHandler(InvalidHistoryLimitException.class)
    public ResponseEntity<Object> handleLimit(InvalidHistoryLimitException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_LIMIT", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Object> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
    }

    // Retries exhausted
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<Object> handleConflict(OptimisticLockingFailureException ex) {
        log.warn("Score update conflict after retries: {}", ex.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "CONCURRENT_UPDATE", "Score was updated concurrently, retry");
    }

    private ResponseEntity<Object> buildResponse(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
