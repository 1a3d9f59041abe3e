package com.adlanda.ragassistant.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps exceptions to {@link ApiError} responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RagException.class)
    public ResponseEntity<ApiError> handleRagException(RagException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        ErrorKind kind = ex.getKind();

        if (kind.status().is5xxServerError()) {
            log.error("{} [{}]: {}", kind, errorId, ex.getMessage(), ex);
        } else {
            log.warn("{} [{}]: {}", kind, errorId, ex.getMessage());
        }

        return build(errorId, kind, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        String errorId = generateErrorId();
        log.warn("Validation failed [{}]: {}", errorId, message);

        return build(errorId, ErrorKind.VALIDATION_ERROR, message, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

        return build(errorId, ErrorKind.VALIDATION_ERROR, "Malformed request", request);
    }

    private ResponseEntity<ApiError> build(String errorId, ErrorKind kind, String message,
                                           HttpServletRequest request) {
        return ResponseEntity.status(kind.status())
                .body(new ApiError(errorId, kind, message, request.getRequestURI(), Instant.now()));
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
