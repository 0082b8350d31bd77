package com.coinpulse.core.feed;

import java.net.URI;
import java.util.List;

/**
 * An RSS/Atom endpoint.
 */
public record FeedSource(String id, String name, String url) {

    /**
     * Host part of the feed URL, used as the article's source domain.
     */
    public String domain() {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    // === Pre-configured sources ===

    public static FeedSource coinDesk() {
        return new FeedSource("coindesk", "CoinDesk",
            "https://feeds.feedburner.com/coindesk/CoinDesk");
    }

    public static FeedSource coinTelegraph() {
        return new FeedSource("cointelegraph", "CoinTelegraph",
            "https://cointelegraph.com/rss");
    }

    public static FeedSource decrypt() {
        return new FeedSource("decrypt", "Decrypt",
            "https://decrypt.co/feed");
    }

    /**
     * Default sources, in fetch order.
     */
    public static List<FeedSource> defaultSources() {
        return List.of(
            coinDesk(),
            coinTelegraph(),
            decrypt()
        );
    }
}
