package com.adlanda.ragassistant.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced to callers. Each kind maps to one HTTP status.
 */
public enum ErrorKind {

    NOT_FOUND(HttpStatus.NOT_FOUND),
    UNSUPPORTED_FORMAT(HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    EXTRACTION_FAILURE(HttpStatus.UNPROCESSABLE_ENTITY),
    CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    STORE_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    GENERATION_ERROR(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
