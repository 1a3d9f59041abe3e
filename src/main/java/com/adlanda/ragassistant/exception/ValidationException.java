package com.adlanda.ragassistant.exception;

/** Thrown for empty queries and missing required request fields. */
public class ValidationException extends RagException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
