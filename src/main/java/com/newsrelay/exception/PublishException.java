package com.newsrelay.exception;

/**
 * A single destination rejected or failed a post. {@code transientFailure} marks
 * errors worth an immediate retry (timeouts, I/O, 5xx).
 */
public class PublishException extends RelayException {

    private final int statusCode;
    private final boolean transientFailure;

    public PublishException(String message, int statusCode, boolean transientFailure) {
        super("PUBLISH_ERROR", message);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public PublishException(String message, Throwable cause) {
        super("PUBLISH_ERROR", message, cause);
        this.statusCode = 0;
        this.transientFailure = true;
    }

    public static PublishException fromStatus(int statusCode, String body) {
        String detail = body == null ? "" : body.length() > 500 ? body.substring(0, 500) : body;
        boolean retryable = statusCode >= 500;
        String kind = retryable ? "Server error" : "Client error";
        return new PublishException(kind + ": " + statusCode + (detail.isEmpty() ? "" : " " + detail),
                statusCode, retryable);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
