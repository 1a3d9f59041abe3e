package com.adlanda.ragassistant.exception;

/** Thrown for invalid settings, such as a chunk overlap not smaller than the chunk size. */
public class ConfigurationException extends RagException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION_ERROR, message, cause);
    }
}
