package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.http.HttpFetcher;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fiat exchange-rate snapshot against USD.
 *
 * API Endpoint: GET /latest?base=USD
 * Response format: { base, date, rates: { EUR: 0.92, GBP: 0.79, ... } }
 */
public class FiatRateAdapter {

    private static final Logger log = LoggerFactory.getLogger(FiatRateAdapter.class);

    private final HttpFetcher fetcher;
    private final String baseUrl;

    public FiatRateAdapter(HttpFetcher fetcher, String baseUrl) {
        this.fetcher = fetcher;
        this.baseUrl = baseUrl;
    }

    /**
     * Upper-case currency code to units of that currency per 1 USD.
     */
    public FetchOutcome<Map<String, Double>> latestUsdRates() {
        FetchOutcome<JsonNode> response = fetcher.fetchJson(baseUrl + "/latest", Map.of("base", "USD"));

        Map<String, Double> rates = new LinkedHashMap<>();
        JsonNode ratesNode = response.value().path("rates");
        Iterator<Map.Entry<String, JsonNode>> fields = ratesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                rates.put(field.getKey().toUpperCase(Locale.ROOT), field.getValue().doubleValue());
            }
        }

        if (rates.isEmpty()) {
            log.warn("Fiat rate snapshot unavailable");
            return FetchOutcome.empty(Map.of(), response.hasData() ? "no rates in response" : response.detail());
        }
        log.debug("Fiat snapshot with {} rates", rates.size());
        return FetchOutcome.data(Map.copyOf(rates));
    }
}
