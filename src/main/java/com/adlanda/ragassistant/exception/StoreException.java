package com.adlanda.ragassistant.exception;

/** Wraps failures of the chunk store or the embedding model behind it. */
public class StoreException extends RagException {

    public StoreException(String message) {
        super(ErrorKind.STORE_ERROR, message);
    }

    public StoreException(String message, Throwable cause) {
        super(ErrorKind.STORE_ERROR, message, cause);
    }
}
