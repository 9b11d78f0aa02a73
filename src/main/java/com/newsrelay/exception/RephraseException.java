package com.newsrelay.exception;

public class RephraseException extends RelayException {

    public RephraseException(String message) {
        super("REPHRASE_ERROR", message);
    }

    public RephraseException(String message, Throwable cause) {
        super("REPHRASE_ERROR", message, cause);
    }

    public static RephraseException noKeyAvailable(int poolSize) {
        return new RephraseException("No rephrase API key available (" + poolSize + " slots cooling down or exhausted)");
    }
}
