package com.project.barcode.localization.exceptions;

import com.project.barcode.localization.DTOs.ErrorResponse;
import com.project.barcode.localization.controller.DetectionApiController;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.time.Instant;

/**
 * Error bodies for the JSON API. Takes precedence over {@link GlobalExceptionHandler}, which
 * renders views. Multipart parsing is lazy (see application.properties) so that upload failures
 * surface once the handler is known and land here.
 */
@RestControllerAdvice(assignableTypes = DetectionApiController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, DetectionException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException exception, HttpServletRequest request) {
        log.warn("Rejected API request: {}", exception.getMessage());
        return build(HttpStatus.BAD_REQUEST, exception.getMessage(), request);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException exception, HttpServletRequest request) {
        log.error("Storage failure during API request", exception);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage(), request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException exception,
                                                           HttpServletRequest request) {
        log.warn("API request without part '{}'", exception.getRequestPartName());
        return build(HttpStatus.BAD_REQUEST, "Missing multipart field '" + exception.getRequestPartName() + "'", request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException exception,
                                                        HttpServletRequest request) {
        log.warn("API upload too large: {}", exception.getMessage());
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "File is too large. Maximum size: 10MB", request);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIo(IOException exception, HttpServletRequest request) {
        log.error("Could not read API upload", exception);
        return build(HttpStatus.BAD_REQUEST, "The uploaded file could not be read", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception exception, HttpServletRequest request) {
        log.error("Unhandled error during API request", exception);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), message,
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
