package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.http.HttpFetcher;
import com.coinpulse.core.model.NewsPost;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * News aggregator posts.
 *
 * API Endpoint: GET /posts/?auth_token=KEY&filter=news&currencies=BTC
 * Without an API key the adapter logs a warning and returns nothing.
 */
public class CryptoPanicAdapter {

    private static final Logger log = LoggerFactory.getLogger(CryptoPanicAdapter.class);

    public static final String DEFAULT_FILTER = "news";
    public static final String DEFAULT_CURRENCIES = "BTC";

    private final HttpFetcher fetcher;
    private final String baseUrl;
    private final String apiKey;

    public CryptoPanicAdapter(HttpFetcher fetcher, String baseUrl, String apiKey) {
        this.fetcher = fetcher;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey != null ? apiKey : "";
    }

    public boolean isConfigured() {
        return !apiKey.isBlank();
    }

    public FetchOutcome<List<NewsPost>> posts(String filter, String currencies) {
        if (!isConfigured()) {
            log.warn("CryptoPanic API key missing. Set CRYPTOPANIC_API_KEY.");
            return FetchOutcome.empty(List.of(), "api key missing");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("auth_token", apiKey);
        params.put("filter", filter == null || filter.isBlank() ? DEFAULT_FILTER : filter.trim());
        params.put("currencies", currencies == null || currencies.isBlank() ? DEFAULT_CURRENCIES : currencies.trim());

        FetchOutcome<JsonNode> response = fetcher.fetchJson(baseUrl + "/posts/", params);

        List<NewsPost> posts = new ArrayList<>();
        for (JsonNode result : response.value().path("results")) {
            List<String> codes = new ArrayList<>();
            for (JsonNode currency : result.path("currencies")) {
                String code = JsonFields.text(currency, "code");
                if (!code.isEmpty()) {
                    codes.add(code);
                }
            }
            posts.add(new NewsPost(
                result.path("id").asLong(0),
                JsonFields.text(result, "kind"),
                JsonFields.text(result, "title"),
                JsonFields.text(result, "url"),
                JsonFields.text(result.path("source"), "domain"),
                JsonFields.text(result, "published_at"),
                codes
            ));
        }

        if (posts.isEmpty()) {
            return FetchOutcome.empty(List.of(), response.hasData() ? "no posts in response" : response.detail());
        }
        log.debug("News aggregator: {} posts", posts.size());
        return FetchOutcome.data(List.copyOf(posts));
    }
}
