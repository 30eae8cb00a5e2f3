package com.adlanda.codexai.controller;

import com.adlanda.codexai.exception.CodexException;
import com.adlanda.codexai.exception.GenerationException;
import com.adlanda.codexai.exception.GenerationTimeoutException;
import com.adlanda.codexai.exception.IndexBackendException;
import com.adlanda.codexai.exception.NotFoundException;
import com.adlanda.codexai.exception.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to HTTP statuses with a {@code {error, message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(IndexBackendException.class)
    public ResponseEntity<Map<String, Object>> indexBackend(IndexBackendException e) {
        log.error("Index backend failure: {}", e.getMessage(), e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "index_unavailable", e);
    }

    @ExceptionHandler(GenerationTimeoutException.class)
    public ResponseEntity<Map<String, Object>> generationTimeout(GenerationTimeoutException e) {
        log.warn(e.getMessage());
        return body(HttpStatus.GATEWAY_TIMEOUT, "generation_timeout", e);
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<Map<String, Object>> generation(GenerationException e) {
        log.error("Generation failure: {}", e.getMessage(), e);
        return body(HttpStatus.BAD_GATEWAY, "generation_failed", e);
    }

    @ExceptionHandler(ParseException.class)
    public ResponseEntity<Map<String, Object>> parse(ParseException e) {
        log.warn("Unparseable model reply: {}", e.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "unparseable_reply", e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(Map.of("error", "invalid_request", "message", message));
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, CodexException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
    }
}
