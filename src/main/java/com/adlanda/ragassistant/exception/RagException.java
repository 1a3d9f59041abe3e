package com.adlanda.ragassistant.exception;

/**
 * Base class for every failure raised by ingestion, retrieval and generation.
 */
public abstract class RagException extends RuntimeException {

    private final ErrorKind kind;

    protected RagException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RagException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
