package com.newsrelay.exception;

public class WebhookAuthenticationException extends RelayException {

    public WebhookAuthenticationException(String message) {
        super("WEBHOOK_AUTH_ERROR", message);
    }
}
