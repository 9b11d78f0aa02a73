package com.newsrelay.exception;

/**
 * Base class for failures raised by the relay pipeline.
 */
public class RelayException extends RuntimeException {

    private final String errorCode;

    public RelayException(String message) {
        this("RELAY_ERROR", message);
    }

    public RelayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RelayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
