package com.adlanda.ragassistant.exception;

/** Wraps failures, timeouts and cancellations of the answer generation call. */
public class GenerationException extends RagException {

    public GenerationException(String message) {
        super(ErrorKind.GENERATION_ERROR, message);
    }

    public GenerationException(String message, Throwable cause) {
        super(ErrorKind.GENERATION_ERROR, message, cause);
    }
}
