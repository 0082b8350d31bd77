package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.http.HttpFetcher;
import com.coinpulse.core.model.HistorySeries;
import com.coinpulse.core.model.SeriesPoint;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Daily candle history adapter.
 *
 * API Endpoint: GET /histoday?fsym=BTC&tsym=USD&limit=30
 * Response format: { Response, Message, Data: { Data: [ { time, close, volumefrom, volumeto, ... } ] } }
 */
public class CryptoCompareAdapter {

    private static final Logger log = LoggerFactory.getLogger(CryptoCompareAdapter.class);

    private final HttpFetcher fetcher;
    private final String baseUrl;

    public CryptoCompareAdapter(HttpFetcher fetcher, String baseUrl) {
        this.fetcher = fetcher;
        this.baseUrl = baseUrl;
    }

    public FetchOutcome<HistorySeries> dailyHistory(String symbol, int days) {
        if (symbol == null || symbol.isBlank() || days <= 0) {
            return FetchOutcome.empty(HistorySeries.empty(), "symbol and positive days required");
        }
        String fsym = symbol.trim().toUpperCase(Locale.ROOT);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("fsym", fsym);
        params.put("tsym", "USD");
        params.put("limit", String.valueOf(days));

        FetchOutcome<JsonNode> response = fetcher.fetchJson(baseUrl + "/histoday", params);
        JsonNode root = response.value();
        if ("Error".equalsIgnoreCase(JsonFields.text(root, "Response"))) {
            log.warn("History request for {} rejected: {}", fsym, JsonFields.text(root, "Message"));
        }

        List<Candle> candles = new ArrayList<>();
        int skipped = 0;
        for (JsonNode record : root.path("Data").path("Data")) {
            Optional<Candle> candle = parseCandle(record);
            if (candle.isPresent()) {
                candles.add(candle.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed daily records for {}", skipped, fsym);
        }

        // List.sort is stable, equal timestamps keep upstream order
        candles.sort(Comparator.comparingLong(Candle::timestampMillis));

        List<SeriesPoint> prices = new ArrayList<>(candles.size());
        List<SeriesPoint> marketCaps = new ArrayList<>(candles.size());
        List<SeriesPoint> volumes = new ArrayList<>(candles.size());
        for (Candle c : candles) {
            prices.add(new SeriesPoint(c.timestampMillis(), c.close()));
            // Approximate market cap: volumefrom * close
            marketCaps.add(new SeriesPoint(c.timestampMillis(), c.volumeFrom() * c.close()));
            volumes.add(new SeriesPoint(c.timestampMillis(), c.volumeTo()));
        }

        HistorySeries series = new HistorySeries(prices, marketCaps, volumes);
        if (series.isEmpty()) {
            log.warn("No historical data found for {}", fsym);
            return FetchOutcome.empty(series, response.hasData() ? "no daily records" : response.detail());
        }
        return FetchOutcome.data(series);
    }

    private static Optional<Candle> parseCandle(JsonNode record) {
        OptionalLong time = JsonFields.optionalLong(record, "time");
        OptionalDouble close = JsonFields.optionalNumber(record, "close");
        if (time.isEmpty() || close.isEmpty()) {
            return Optional.empty();
        }
        if (isMalformed(record, "volumefrom") || isMalformed(record, "volumeto")) {
            return Optional.empty();
        }
        return Optional.of(new Candle(
            time.getAsLong() * 1000L,
            close.getAsDouble(),
            JsonFields.number(record, "volumefrom"),
            JsonFields.number(record, "volumeto")
        ));
    }

    /**
     * Absent volume counts as 0; a present but non-numeric one makes the record malformed.
     */
    private static boolean isMalformed(JsonNode record, String field) {
        JsonNode value = record.path(field);
        return !value.isMissingNode() && !value.isNull() && JsonFields.optionalNumber(record, field).isEmpty();
    }

    private record Candle(long timestampMillis, double close, double volumeFrom, double volumeTo) {}
}
