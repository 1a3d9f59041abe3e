package com.adlanda.ragassistant.exception;

/** Thrown when a file extension is not one of the supported document formats. */
public class UnsupportedFormatException extends RagException {

    public UnsupportedFormatException(String message) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message, cause);
    }
}
