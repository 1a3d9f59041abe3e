package com.adlanda.ragassistant.exception;

/** Thrown when input bytes or a requested document are missing or cannot be opened. */
public class NotFoundException extends RagException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
