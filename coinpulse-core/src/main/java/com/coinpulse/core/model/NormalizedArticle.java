package com.coinpulse.core.model;

/**
 * Article extracted from any RSS/Atom feed. Fields are never null; absent values
 * fall back to {@link #NO_TITLE} for the title and an empty string otherwise.
 */
public record NormalizedArticle(
    String title,
    String url,
    String description,
    String publishedAt,     // RFC 1123, UTC
    String sourceDomain     // host of the feed, e.g. "cointelegraph.com"
) {
    public static final String NO_TITLE = "No title";
}
