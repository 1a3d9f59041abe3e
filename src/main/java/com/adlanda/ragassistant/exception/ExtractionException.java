package com.adlanda.ragassistant.exception;

/** Thrown when a document cannot be parsed or yields no extractable text. */
public class ExtractionException extends RagException {

    public ExtractionException(String message) {
        super(ErrorKind.EXTRACTION_FAILURE, message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_FAILURE, message, cause);
    }
}
