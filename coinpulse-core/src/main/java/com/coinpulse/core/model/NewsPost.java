package com.coinpulse.core.model;

import java.util.List;

/**
 * Post from the news aggregator API.
 */
public record NewsPost(
    long id,
    String kind,
    String title,
    String url,
    String sourceDomain,
    String publishedAt,
    List<String> currencies     // ticker codes, e.g. ["BTC", "ETH"]
) {
    public NewsPost {
        currencies = List.copyOf(currencies);
    }
}
