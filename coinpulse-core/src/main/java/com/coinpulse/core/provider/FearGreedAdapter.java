package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.http.HttpFetcher;
import com.coinpulse.core.model.SentimentReading;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Fear and greed index.
 *
 * Response format: { data: [ { value: "45", value_classification: "Fear", timestamp: "1700000000", time_until_update: "3600" } ] }
 * Values arrive as strings.
 */
public class FearGreedAdapter {

    private static final Logger log = LoggerFactory.getLogger(FearGreedAdapter.class);

    private final HttpFetcher fetcher;
    private final String url;

    public FearGreedAdapter(HttpFetcher fetcher, String url) {
        this.fetcher = fetcher;
        this.url = url;
    }

    public FetchOutcome<Optional<SentimentReading>> latest() {
        FetchOutcome<JsonNode> response = fetcher.fetchJson(url + "/");

        JsonNode latest = response.value().path("data").path(0);
        OptionalDouble value = JsonFields.optionalNumber(latest, "value");
        if (value.isEmpty()) {
            log.warn("Sentiment index returned no data point");
            return FetchOutcome.empty(Optional.empty(), response.hasData() ? "no data point" : response.detail());
        }

        OptionalLong until = JsonFields.optionalLong(latest, "time_until_update");
        SentimentReading reading = new SentimentReading(
            (int) Math.round(value.getAsDouble()),
            JsonFields.text(latest, "value_classification"),
            JsonFields.optionalLong(latest, "timestamp").orElse(0L),
            until.isPresent() ? until.getAsLong() : null
        );
        return FetchOutcome.data(Optional.of(reading));
    }
}
