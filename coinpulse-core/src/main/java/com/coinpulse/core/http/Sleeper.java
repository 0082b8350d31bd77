package com.coinpulse.core.http;

import java.time.Duration;

/**
 * Pause between retry attempts. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
