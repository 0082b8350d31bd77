package com.coinpulse.core.model;

/**
 * Most recent fear and greed index reading.
 *
 * @param value              index value, 0 (extreme fear) to 100 (extreme greed)
 * @param classification     upstream label, e.g. "Fear", "Greed"
 * @param timestamp          epoch seconds of the reading
 * @param secondsUntilUpdate seconds until the next reading, null when not reported
 */
public record SentimentReading(
    int value,
    String classification,
    long timestamp,
    Long secondsUntilUpdate
) {
}
