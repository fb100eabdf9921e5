package com.accesslist.api.rest;

import com.accesslist.core.exception.AccessListValidationException;
import com.accesslist.core.exception.AggregateStateException;
import com.accesslist.core.exception.DuplicateAccessListException;
import com.accesslist.core.exception.RegistryException;
import com.accesslist.core.exception.RetriesExhaustedException;
import com.accesslist.engine.logging.LoggingContext;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps registry exceptions to HTTP responses.
 * Condition outcomes never get here; they are ordinary results of the service.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST_CODE = "BAD_REQUEST";
    static final String INTERNAL_ERROR_CODE = "INTERNAL_ERROR";

    @ExceptionHandler(AccessListValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(AccessListValidationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), ex.getParameter(), ex, request);
    }

    @ExceptionHandler({AggregateStateException.class, DuplicateAccessListException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RegistryException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), null, ex, request);
    }

    @ExceptionHandler(RetriesExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleRetriesExhausted(RetriesExhaustedException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), null, ex, request);
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST_CODE, ex.getMessage(), null, ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(INTERNAL_ERROR_CODE, "Internal server error", null, LoggingContext.getTraceId()));
    }

    private ResponseEntity<ErrorResponse> respond(
            HttpStatus status, String code, String message, String parameter, Exception ex, HttpServletRequest request) {
        log.warn("Request {} {} failed with {}: {} ({})",
            request.getMethod(), request.getRequestURI(), status.value(), code, ex.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(code, message, parameter, LoggingContext.getTraceId()));
    }

    public record ErrorResponse(String code, String message, String parameter, String traceId) {}
}
