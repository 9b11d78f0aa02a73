package com.newsrelay.model;

/**
 * A configured publish target. {@code accountRef} is the page id for Facebook and
 * an account label for X/Twitter; {@code credential} is the token used to post.
 */
public record Destination(
    Platform platform,
    String accountRef,
    String credential,
    boolean enabled
) {
    public enum Platform { FACEBOOK, TWITTER }

    /** Label safe for logs: never includes the credential. */
    public String label() {
        String ref = accountRef != null && !accountRef.isBlank() ? accountRef : maskedCredential();
        return platform.name().toLowerCase() + ":" + ref;
    }

    public String maskedCredential() {
        if (credential == null || credential.length() < 4) {
            return "****";
        }
        return "****" + credential.substring(credential.length() - 4);
    }

    @Override
    public String toString() {
        return "Destination[" + label() + ", enabled=" + enabled + "]";
    }
}
