package com.example.learningsession.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({SessionNotFoundException.class, MessageNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e, ServerHttpRequest request) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, InvalidResponseException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e, ServerHttpRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler(ActivityPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(ActivityPersistenceException e, ServerHttpRequest request) {
        logger.error("Activity for message {} not stored: {}", e.getMessageId(), e.getMessage());
        String message = e.isRetryable()
                ? "Could not save your answer, please try again"
                : "Could not save your answer: " + e.getMessage();
        HttpStatus status = e.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.UNPROCESSABLE_ENTITY;
        return respond(status, message, request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, ServerHttpRequest request) {
        ErrorResponse body = new ErrorResponse(status.value(), message, request.getPath().value(), Instant.now());
        return ResponseEntity.status(status).body(body);
    }
}
