package com.registry.api.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.registry.core.exception.AlreadyExistsException;
import com.registry.core.exception.IntegrityException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.RegistryException;
import com.registry.core.exception.RegistryValidationException;
import com.registry.core.exception.StorageException;
import com.registry.core.model.ManifestMismatch;
import com.registry.engine.logging.LoggingContext;
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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Maps registry errors to HTTP statuses with a structured body, so clients
 * can branch on {@code code} and {@code context} instead of messages.
 */
@RestControllerAdvice
public class RegistryExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RegistryExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistryException(RegistryException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex);
        List<ManifestMismatch> mismatches = ex instanceof IntegrityException integrity
            ? integrity.getMismatches() : null;

        if (status.is5xxServerError()) {
            log.error("{} {} failed with {}: {} {}",
                request.getMethod(), request.getRequestURI(), ex.getErrorCode(), ex.getMessage(), ex.getContext(), ex);
        } else {
            log.warn("{} {} rejected with {}: {} {}",
                request.getMethod(), request.getRequestURI(), ex.getErrorCode(), ex.getMessage(), ex.getContext());
        }

        return ResponseEntity.status(status).body(new ErrorResponse(
            ex.getErrorCode(),
            ex.getMessage(),
            ex.getContext(),
            mismatches,
            LoggingContext.getTraceId(),
            Instant.now()
        ));
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("{} {} malformed request: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            BAD_REQUEST, ex.getMessage(), Map.of(), null, LoggingContext.getTraceId(), Instant.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("{} {} failed unexpectedly", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
            INTERNAL_ERROR, "Internal error", Map.of(), null, LoggingContext.getTraceId(), Instant.now()));
    }

    static HttpStatus statusOf(RegistryException ex) {
        if (ex instanceof RegistryValidationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof AlreadyExistsException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof IntegrityException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (ex instanceof StorageException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
        String code,
        String message,
        Map<String, String> context,
        List<ManifestMismatch> mismatches,
        String traceId,
        Instant timestamp
    ) {}
}
