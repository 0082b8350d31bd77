package com.coinpulse.core.http;

import java.io.IOException;

/**
 * Upstream answered 429 Too Many Requests.
 */
public class RateLimitedException extends IOException {

    public RateLimitedException(String message) {
        super(message);
    }
}
