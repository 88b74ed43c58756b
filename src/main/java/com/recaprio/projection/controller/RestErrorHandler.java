package com.recaprio.projection.controller;

import com.recaprio.projection.exception.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Maps failures of the REST surface to a uniform error body.
 */
@Slf4j
@RestControllerAdvice
public class RestErrorHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorPayload> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {} (path={})", detail, request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, detail, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(Exception ex, HttpServletRequest request) {
        String detail = ex.getMessage() == null || ex.getMessage().isBlank()
                ? "Request could not be processed"
                : ex.getMessage();
        log.warn("Bad request: {} (path={})", detail, request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, detail, request);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorPayload> handleNotFound(NoSuchElementException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler({StoreUnavailableException.class, DataAccessException.class})
    public ResponseEntity<ErrorPayload> handleStorage(RuntimeException ex, HttpServletRequest request) {
        log.error("Storage failure on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorPayload> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorPayload> respond(HttpStatus status, String message, HttpServletRequest request) {
        ErrorPayload body = new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(),
                message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
