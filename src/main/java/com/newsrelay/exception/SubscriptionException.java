package com.newsrelay.exception;

public class SubscriptionException extends RelayException {

    private final int statusCode;
    private final boolean retryable;

    public SubscriptionException(String message, int statusCode, boolean retryable) {
        super("SUBSCRIPTION_ERROR", message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public SubscriptionException(String message, Throwable cause) {
        super("SUBSCRIPTION_ERROR", message, cause);
        this.statusCode = 0;
        this.retryable = true;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
