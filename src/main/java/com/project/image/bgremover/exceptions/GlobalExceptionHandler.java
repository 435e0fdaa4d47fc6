package com.project.image.bgremover.exceptions;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ModelUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleModelUnavailable(ModelUnavailableException ex) {
        log.warn("Model unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex.errorKind());
    }

    @ExceptionHandler({DecodeException.class, UnsupportedFormatException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(BackgroundRemovalException ex) {
        log.warn("Domain error: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.errorKind());
    }

    @ExceptionHandler(BackgroundRemovalException.class)
    public ResponseEntity<Map<String, Object>> handleProcessingError(BackgroundRemovalException ex) {
        log.error("Processing failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex.errorKind());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        if (ex.isIoFailure()) {
            log.error("Storage failure", ex);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex.errorKind());
        }
        log.warn("Storage error: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.errorKind());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "File too large. Maximum size is 16MB", null);
    }

    @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
            MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleValidationErrors(Exception ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request: " + ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "Resource not found", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknownException(Exception ex) {
        log.error("Unhandled error occurred", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String kind) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (kind != null) {
            body.put("error_kind", kind);
        }
        return ResponseEntity.status(status).body(body);
    }
}
