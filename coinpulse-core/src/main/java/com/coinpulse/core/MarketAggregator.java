package com.coinpulse.core;

import com.coinpulse.core.cache.CacheKey;
import com.coinpulse.core.cache.CacheStore;
import com.coinpulse.core.cache.TtlCacheStore;
import com.coinpulse.core.config.AggregatorConfig;
import com.coinpulse.core.feed.FeedAggregator;
import com.coinpulse.core.feed.FeedNormalizer;
import com.coinpulse.core.feed.FeedSource;
import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.http.HttpClientFactory;
import com.coinpulse.core.http.HttpFetcher;
import com.coinpulse.core.http.Sleeper;
import com.coinpulse.core.model.CoinMarket;
import com.coinpulse.core.model.Conversion;
import com.coinpulse.core.model.ConversionTable;
import com.coinpulse.core.model.HistorySeries;
import com.coinpulse.core.model.NewsPost;
import com.coinpulse.core.model.NftAsset;
import com.coinpulse.core.model.NormalizedArticle;
import com.coinpulse.core.model.PriceQuote;
import com.coinpulse.core.model.SearchResults;
import com.coinpulse.core.model.SentimentReading;
import com.coinpulse.core.model.SortOrder;
import com.coinpulse.core.model.TrendingCoin;
import com.coinpulse.core.provider.CoinGeckoAdapter;
import com.coinpulse.core.provider.CryptoCompareAdapter;
import com.coinpulse.core.provider.CryptoPanicAdapter;
import com.coinpulse.core.provider.ExchangeRateComposer;
import com.coinpulse.core.provider.FearGreedAdapter;
import com.coinpulse.core.provider.FiatRateAdapter;
import com.coinpulse.core.provider.OpenSeaAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Single entry point for market, sentiment and news queries.
 *
 * Every query goes cache check -> adapter -> cache store. Only complete results are
 * cached, so a failed or degraded fetch is retried on the next call instead of being
 * served for a whole TTL. Upstream failure never surfaces as an exception: callers
 * get an empty list, map or Optional instead.
 *
 * Thread-safe; usable from a web handler, a CLI or a batch job.
 */
public class MarketAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MarketAggregator.class);

    public static final int DEFAULT_NEWS_LIMIT = 20;

    private final CacheStore cache;
    private final CoinGeckoAdapter coinGecko;
    private final CryptoCompareAdapter cryptoCompare;
    private final FiatRateAdapter fiatRates;
    private final ExchangeRateComposer rateComposer;
    private final OpenSeaAdapter openSea;
    private final CryptoPanicAdapter cryptoPanic;
    private final FearGreedAdapter fearGreed;
    private final FeedAggregator feeds;
    private final List<FeedSource> feedSources;

    public MarketAggregator(AggregatorConfig config) {
        this(config, new TtlCacheStore(Clock.systemUTC(), config.getCacheTtl()),
            new HttpFetcher(HttpClientFactory.getClient(), HttpClientFactory.getMapper(), Sleeper.system(),
                config.getFetchTimeout(), config.getMaxAttempts()));
    }

    public MarketAggregator(AggregatorConfig config, CacheStore cache, HttpFetcher fetcher) {
        this(cache,
            new CoinGeckoAdapter(fetcher, config.getCoinGeckoUrl()),
            new CryptoCompareAdapter(fetcher, config.getCryptoCompareUrl()),
            new FiatRateAdapter(fetcher, config.getFiatRatesUrl()),
            new ExchangeRateComposer(),
            new OpenSeaAdapter(fetcher, config.getOpenSeaUrl(), config.getOpenSeaApiKey()),
            new CryptoPanicAdapter(fetcher, config.getCryptoPanicUrl(), config.getCryptoPanicApiKey()),
            new FearGreedAdapter(fetcher, config.getFearGreedUrl()),
            new FeedAggregator(fetcher, new FeedNormalizer(), config.getFeedTimeout(), config.getFeedWorkers()),
            config.getFeedSources());
    }

    MarketAggregator(CacheStore cache, CoinGeckoAdapter coinGecko, CryptoCompareAdapter cryptoCompare,
                     FiatRateAdapter fiatRates, ExchangeRateComposer rateComposer, OpenSeaAdapter openSea,
                     CryptoPanicAdapter cryptoPanic, FearGreedAdapter fearGreed, FeedAggregator feeds,
                     List<FeedSource> feedSources) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.coinGecko = coinGecko;
        this.cryptoCompare = cryptoCompare;
        this.fiatRates = fiatRates;
        this.rateComposer = rateComposer;
        this.openSea = openSea;
        this.cryptoPanic = cryptoPanic;
        this.fearGreed = fearGreed;
        this.feeds = feeds;
        this.feedSources = List.copyOf(feedSources);
    }

    // ==================== Market data ====================

    public List<TrendingCoin> trendingCoins() {
        return cached(CacheKey.of("trending_coins"), List.of(), coinGecko::trending);
    }

    /**
     * Quotes keyed by normalized (trimmed, lower-case) coin id. Coins the provider
     * has no price for are absent from the map.
     */
    public Map<String, PriceQuote> coinPrices(Collection<String> coinIds, String currency) {
        List<String> ids = normalizeIds(coinIds);
        String vs = currency == null || currency.isBlank() ? "usd" : currency.trim().toLowerCase(Locale.ROOT);
        if (ids.isEmpty()) {
            return Map.of();
        }
        return cached(CacheKey.of("coin_prices", ids, vs), Map.of(), () -> coinGecko.simplePrices(ids, vs));
    }

    public List<CoinMarket> topCoins(int limit, int page) {
        return topCoins(limit, page, SortOrder.MARKET_CAP_DESC);
    }

    /**
     * One page of the markets listing in the provider's own ordering. No local re-sorting.
     */
    public List<CoinMarket> topCoins(int limit, int page, SortOrder order) {
        SortOrder sort = order != null ? order : SortOrder.MARKET_CAP_DESC;
        return cached(CacheKey.of("top_coins", limit, page, sort.name()), List.of(),
            () -> coinGecko.markets(limit, page, sort));
    }

    public SearchResults searchCoins(String query) {
        if (query == null || query.isBlank()) {
            return SearchResults.empty();
        }
        String q = query.trim();
        return cached(CacheKey.of("search_coins", q.toLowerCase(Locale.ROOT)), SearchResults.empty(),
            () -> coinGecko.search(q));
    }

    public HistorySeries coinHistory(String symbol, int days) {
        if (symbol == null || symbol.isBlank()) {
            return HistorySeries.empty();
        }
        String sym = symbol.trim().toUpperCase(Locale.ROOT);
        return cached(CacheKey.of("history", sym, days), HistorySeries.empty(),
            () -> cryptoCompare.dailyHistory(sym, days));
    }

    // ==================== Conversion ====================

    /**
     * Reference coins priced in USD, EUR, GBP and JPY. USD prices come through
     * {@link #coinPrices}, so a cached price lookup is reused.
     */
    public ConversionTable exchangeRates() {
        return cached(CacheKey.of("exchange_rates"), ConversionTable.empty(), () -> {
            Map<String, PriceQuote> usdPrices = coinPrices(ExchangeRateComposer.REFERENCE_COINS, "usd");
            return rateComposer.compose(usdPrices, fiatSnapshot());
        });
    }

    /**
     * Convert an amount of a reference coin into a table currency.
     */
    public Optional<Conversion> convert(String fromCoin, String toCurrency, double amount) {
        if (fromCoin == null || toCurrency == null || !Double.isFinite(amount)) {
            return Optional.empty();
        }
        String from = fromCoin.trim().toLowerCase(Locale.ROOT);
        String to = toCurrency.trim().toLowerCase(Locale.ROOT);
        return exchangeRates().rate(from, to)
            .map(rate -> new Conversion(from, to, amount, amount * rate, rate));
    }

    private FetchOutcome<Map<String, Double>> fiatSnapshot() {
        CacheKey key = CacheKey.of("fiat_rates");
        Map<String, Double> snapshot = cached(key, Map.of(), fiatRates::latestUsdRates);
        return snapshot.isEmpty()
            ? FetchOutcome.empty(snapshot, "fiat snapshot unavailable")
            : FetchOutcome.data(snapshot);
    }

    // ==================== NFTs, news, sentiment ====================

    public List<NftAsset> nftsByWallet(String walletAddress, String chain) {
        String chainId = chain == null || chain.isBlank() ? "ethereum" : chain.trim().toLowerCase(Locale.ROOT);
        if (!openSea.isConfigured()) {
            // Adapter logs the missing key; don't occupy a cache slot for it
            return openSea.nftsByWallet(walletAddress, chainId).value();
        }
        if (walletAddress == null || walletAddress.isBlank()) {
            return List.of();
        }
        String address = walletAddress.trim();
        return cached(CacheKey.of("nfts", address, chainId), List.of(),
            () -> openSea.nftsByWallet(address, chainId));
    }

    public List<NormalizedArticle> news() {
        return news(DEFAULT_NEWS_LIMIT);
    }

    /**
     * Articles from the configured RSS feeds, in feed order, at most {@code limit}.
     */
    public List<NormalizedArticle> news(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return cached(CacheKey.of("crypto_news", limit), List.of(), () -> feeds.collect(feedSources, limit));
    }

    public List<NewsPost> newsPosts(String filter, String currencies) {
        if (!cryptoPanic.isConfigured()) {
            return cryptoPanic.posts(filter, currencies).value();
        }
        String f = filter == null || filter.isBlank() ? CryptoPanicAdapter.DEFAULT_FILTER : filter.trim();
        String c = currencies == null || currencies.isBlank()
            ? CryptoPanicAdapter.DEFAULT_CURRENCIES
            : currencies.trim().toUpperCase(Locale.ROOT);
        return cached(CacheKey.of("news_posts", f, c), List.of(), () -> cryptoPanic.posts(f, c));
    }

    public Optional<SentimentReading> sentimentIndex() {
        return cached(CacheKey.of("fear_greed"), Optional.empty(), fearGreed::latest);
    }

    public int cacheSize() {
        return cache.size();
    }

    // ==================== Cache plumbing ====================

    @SuppressWarnings("unchecked")
    private <T> T cached(CacheKey key, T emptyValue, Supplier<FetchOutcome<T>> loader) {
        Optional<Object> hit = cache.get(key);
        if (hit.isPresent()) {
            log.debug("Cache hit: {}", key);
            return (T) hit.get();
        }

        log.debug("Cache miss: {}", key);
        FetchOutcome<T> outcome;
        try {
            outcome = loader.get();
        } catch (RuntimeException e) {
            log.error("Unexpected failure loading {}", key, e);
            return emptyValue;
        }

        if (outcome.isCacheable()) {
            cache.put(key, outcome.value());
        } else {
            log.debug("Not caching {} ({}: {})", key, outcome.status(), outcome.detail());
        }
        return outcome.value();
    }

    static List<String> normalizeIds(Collection<String> coinIds) {
        if (coinIds == null) {
            return List.of();
        }
        return coinIds.stream()
            .filter(Objects::nonNull)
            .map(id -> id.trim().toLowerCase(Locale.ROOT))
            .filter(id -> !id.isEmpty())
            .distinct()
            .sorted()
            .toList();
    }

    @Override
    public void close() {
        feeds.close();
    }
}
