package com.coinpulse.core.feed;

/**
 * A feed payload could not be parsed as RSS/Atom.
 */
public class FeedParseException extends Exception {

    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
