package com.newsrelay.exception;

/**
 * The payload holds no RSS, Atom or RDF document at all. Malformed single entries
 * never raise this; they are skipped.
 */
public class FeedParseException extends RelayException {

    public FeedParseException(String message) {
        super("FEED_PARSE_ERROR", message);
    }

    public FeedParseException(String message, Throwable cause) {
        super("FEED_PARSE_ERROR", message, cause);
    }
}
