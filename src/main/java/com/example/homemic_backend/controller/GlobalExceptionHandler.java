package com.example.homemic_backend.controller;

import com.example.homemic_backend.exception.ClipTooLargeException;
import com.example.homemic_backend.exception.ClipValidationException;
import com.example.homemic_backend.exception.IllegalClipStateException;
import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.exception.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps domain and framework exceptions to {@link ApiError} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ClipValidationException.class)
    ResponseEntity<ApiError> handleValidation(ClipValidationException ex) {
        LOGGER.warn("Rejected clip: field={} reason={}", ex.getField(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "CLIP_INVALID", ex.getMessage(), ex.getField());
    }

    @ExceptionHandler({IllegalArgumentException.class, TypeMismatchException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOGGER.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Request body failed validation", details);
    }

    @ExceptionHandler(ClipTooLargeException.class)
    ResponseEntity<ApiError> handleTooLarge(ClipTooLargeException ex) {
        LOGGER.warn("Rejected clip: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "CLIP_TOO_LARGE", ex.getMessage(), "max_bytes=" + ex.getMaxBytes());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleMultipartTooLarge(MaxUploadSizeExceededException ex) {
        LOGGER.warn("Rejected multipart upload: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "CLIP_TOO_LARGE", "Upload exceeds the configured maximum size", null);
    }

    @ExceptionHandler(NotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), ex.getResource());
    }

    @ExceptionHandler(IllegalClipStateException.class)
    ResponseEntity<ApiError> handleConflict(IllegalClipStateException ex) {
        return error(HttpStatus.CONFLICT, "CLIP_STATE_CONFLICT", ex.getMessage(),
                ex.getStatus() == null ? null : "status=" + ex.getStatus().wire());
    }

    /**
     * Transient: the node should retry the upload.
     */
    @ExceptionHandler(StorageFailureException.class)
    ResponseEntity<ApiError> handleStorage(StorageFailureException ex) {
        LOGGER.error("Storage failure", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE", "Clip storage temporarily unavailable",
                "Please retry the upload");
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            if (status.is5xxServerError()) {
                LOGGER.error("Request failed", ex);
            }
            return ResponseEntity.status(status)
                    .body(new ApiError(codeFor(status), framework.getBody().getDetail(), null, Instant.now()));
        }
        LOGGER.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    private static String codeFor(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved == null ? "HTTP_" + status.value() : resolved.name();
    }

    public record ApiError(
            String errorCode,
            String message,
            String details,
            Instant timestamp
    ) {}
}
