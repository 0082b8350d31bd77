package com.coinpulse.core.config;

import com.coinpulse.core.feed.FeedSource;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for the aggregation layer.
 *
 * {@link #load()} reads system properties first, then environment variables,
 * then falls back to defaults. API keys are optional: without them the NFT and
 * news-aggregator queries return empty results.
 */
public class AggregatorConfig {

    public static final String DEFAULT_COINGECKO_URL = "https://api.coingecko.com/api/v3";
    public static final String DEFAULT_CRYPTOCOMPARE_URL = "https://min-api.cryptocompare.com/data/v2";
    public static final String DEFAULT_FIAT_RATES_URL = "https://api.exchangerate.host";
    public static final String DEFAULT_OPENSEA_URL = "https://api.opensea.io/api/v2";
    public static final String DEFAULT_CRYPTOPANIC_URL = "https://cryptopanic.com/api/v1";
    public static final String DEFAULT_FEAR_GREED_URL = "https://api.alternative.me/fng";
    public static final int DEFAULT_PORT = 9820;

    private final String coinGeckoUrl;
    private final String cryptoCompareUrl;
    private final String fiatRatesUrl;
    private final String openSeaUrl;
    private final String cryptoPanicUrl;
    private final String fearGreedUrl;
    private final List<FeedSource> feedSources;
    private final String openSeaApiKey;
    private final String cryptoPanicApiKey;
    private final Duration cacheTtl;
    private final Duration fetchTimeout;
    private final Duration feedTimeout;
    private final int maxAttempts;
    private final int feedWorkers;
    private final int port;

    private AggregatorConfig(Builder b) {
        this.coinGeckoUrl = stripTrailingSlash(b.coinGeckoUrl);
        this.cryptoCompareUrl = stripTrailingSlash(b.cryptoCompareUrl);
        this.fiatRatesUrl = stripTrailingSlash(b.fiatRatesUrl);
        this.openSeaUrl = stripTrailingSlash(b.openSeaUrl);
        this.cryptoPanicUrl = stripTrailingSlash(b.cryptoPanicUrl);
        this.fearGreedUrl = stripTrailingSlash(b.fearGreedUrl);
        this.feedSources = List.copyOf(b.feedSources);
        this.openSeaApiKey = b.openSeaApiKey != null ? b.openSeaApiKey.trim() : "";
        this.cryptoPanicApiKey = b.cryptoPanicApiKey != null ? b.cryptoPanicApiKey.trim() : "";
        this.cacheTtl = Objects.requireNonNull(b.cacheTtl, "cacheTtl");
        this.fetchTimeout = Objects.requireNonNull(b.fetchTimeout, "fetchTimeout");
        this.feedTimeout = Objects.requireNonNull(b.feedTimeout, "feedTimeout");
        this.maxAttempts = Math.max(1, b.maxAttempts);
        this.feedWorkers = Math.max(1, b.feedWorkers);
        this.port = b.port;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AggregatorConfig defaults() {
        return builder().build();
    }

    public static AggregatorConfig load() {
        return builder()
            .coinGeckoUrl(setting("coinpulse.coingecko.url", "COINPULSE_COINGECKO_URL", DEFAULT_COINGECKO_URL))
            .cryptoCompareUrl(setting("coinpulse.cryptocompare.url", "COINPULSE_CRYPTOCOMPARE_URL", DEFAULT_CRYPTOCOMPARE_URL))
            .fiatRatesUrl(setting("coinpulse.fiat.url", "COINPULSE_FIAT_URL", DEFAULT_FIAT_RATES_URL))
            .openSeaUrl(setting("coinpulse.opensea.url", "COINPULSE_OPENSEA_URL", DEFAULT_OPENSEA_URL))
            .cryptoPanicUrl(setting("coinpulse.cryptopanic.url", "COINPULSE_CRYPTOPANIC_URL", DEFAULT_CRYPTOPANIC_URL))
            .fearGreedUrl(setting("coinpulse.feargreed.url", "COINPULSE_FEARGREED_URL", DEFAULT_FEAR_GREED_URL))
            .openSeaApiKey(setting("coinpulse.opensea.api_key", "OPENSEA_API_KEY", ""))
            .cryptoPanicApiKey(setting("coinpulse.cryptopanic.api_key", "CRYPTOPANIC_API_KEY", ""))
            .cacheTtl(Duration.ofSeconds(Long.parseLong(
                setting("coinpulse.cache.ttl_seconds", "COINPULSE_CACHE_TTL_SECONDS", "300"))))
            .fetchTimeout(Duration.ofSeconds(Long.parseLong(
                setting("coinpulse.fetch.timeout_seconds", "COINPULSE_FETCH_TIMEOUT_SECONDS", "10"))))
            .feedTimeout(Duration.ofSeconds(Long.parseLong(
                setting("coinpulse.feed.timeout_seconds", "COINPULSE_FEED_TIMEOUT_SECONDS", "5"))))
            .maxAttempts(Integer.parseInt(
                setting("coinpulse.fetch.max_attempts", "COINPULSE_FETCH_MAX_ATTEMPTS", "3")))
            .feedWorkers(Integer.parseInt(
                setting("coinpulse.feed.workers", "COINPULSE_FEED_WORKERS", "3")))
            .port(Integer.parseInt(
                setting("coinpulse.port", "COINPULSE_PORT", String.valueOf(DEFAULT_PORT))))
            .build();
    }

    private static String setting(String property, String envVar, String defaultValue) {
        return System.getProperty(property, System.getenv().getOrDefault(envVar, defaultValue));
    }

    private static String stripTrailingSlash(String url) {
        Objects.requireNonNull(url, "url");
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getCoinGeckoUrl() {
        return coinGeckoUrl;
    }

    public String getCryptoCompareUrl() {
        return cryptoCompareUrl;
    }

    public String getFiatRatesUrl() {
        return fiatRatesUrl;
    }

    public String getOpenSeaUrl() {
        return openSeaUrl;
    }

    public String getCryptoPanicUrl() {
        return cryptoPanicUrl;
    }

    public String getFearGreedUrl() {
        return fearGreedUrl;
    }

    public List<FeedSource> getFeedSources() {
        return feedSources;
    }

    public String getOpenSeaApiKey() {
        return openSeaApiKey;
    }

    public String getCryptoPanicApiKey() {
        return cryptoPanicApiKey;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public Duration getFeedTimeout() {
        return feedTimeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getFeedWorkers() {
        return feedWorkers;
    }

    public int getPort() {
        return port;
    }

    public static class Builder {
        private String coinGeckoUrl = DEFAULT_COINGECKO_URL;
        private String cryptoCompareUrl = DEFAULT_CRYPTOCOMPARE_URL;
        private String fiatRatesUrl = DEFAULT_FIAT_RATES_URL;
        private String openSeaUrl = DEFAULT_OPENSEA_URL;
        private String cryptoPanicUrl = DEFAULT_CRYPTOPANIC_URL;
        private String fearGreedUrl = DEFAULT_FEAR_GREED_URL;
        private List<FeedSource> feedSources = FeedSource.defaultSources();
        private String openSeaApiKey = "";
        private String cryptoPanicApiKey = "";
        private Duration cacheTtl = Duration.ofSeconds(300);
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private Duration feedTimeout = Duration.ofSeconds(5);
        private int maxAttempts = 3;
        private int feedWorkers = 3;
        private int port = DEFAULT_PORT;

        public Builder coinGeckoUrl(String url) { this.coinGeckoUrl = url; return this; }
        public Builder cryptoCompareUrl(String url) { this.cryptoCompareUrl = url; return this; }
        public Builder fiatRatesUrl(String url) { this.fiatRatesUrl = url; return this; }
        public Builder openSeaUrl(String url) { this.openSeaUrl = url; return this; }
        public Builder cryptoPanicUrl(String url) { this.cryptoPanicUrl = url; return this; }
        public Builder fearGreedUrl(String url) { this.fearGreedUrl = url; return this; }
        public Builder feedSources(List<FeedSource> sources) { this.feedSources = sources; return this; }
        public Builder openSeaApiKey(String key) { this.openSeaApiKey = key; return this; }
        public Builder cryptoPanicApiKey(String key) { this.cryptoPanicApiKey = key; return this; }
        public Builder cacheTtl(Duration ttl) { this.cacheTtl = ttl; return this; }
        public Builder fetchTimeout(Duration timeout) { this.fetchTimeout = timeout; return this; }
        public Builder feedTimeout(Duration timeout) { this.feedTimeout = timeout; return this; }
        public Builder maxAttempts(int attempts) { this.maxAttempts = attempts; return this; }
        public Builder feedWorkers(int workers) { this.feedWorkers = workers; return this; }
        public Builder port(int port) { this.port = port; return this; }

        /**
         * Point every JSON provider at one base URL. Used to run against a local mock server.
         */
        public Builder allProvidersAt(String baseUrl) {
            String base = stripTrailingSlash(baseUrl);
            this.coinGeckoUrl = base + "/coingecko";
            this.cryptoCompareUrl = base + "/cryptocompare";
            this.fiatRatesUrl = base + "/fiat";
            this.openSeaUrl = base + "/opensea";
            this.cryptoPanicUrl = base + "/cryptopanic";
            this.fearGreedUrl = base + "/fng";
            return this;
        }

        public AggregatorConfig build() {
            return new AggregatorConfig(this);
        }
    }
}
