package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.http.HttpFetcher;
import com.coinpulse.core.model.CoinMarket;
import com.coinpulse.core.model.PriceQuote;
import com.coinpulse.core.model.SearchHit;
import com.coinpulse.core.model.SearchResults;
import com.coinpulse.core.model.SortOrder;
import com.coinpulse.core.model.TrendingCoin;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Market data adapter: trending, markets listing, search and simple prices.
 *
 * Endpoints:
 * - GET /search/trending
 * - GET /coins/markets
 * - GET /search
 * - GET /simple/price
 */
public class CoinGeckoAdapter {

    private static final Logger log = LoggerFactory.getLogger(CoinGeckoAdapter.class);

    // CoinGecko caps per_page at 250
    private static final int MAX_PER_PAGE = 250;

    private final HttpFetcher fetcher;
    private final String baseUrl;

    public CoinGeckoAdapter(HttpFetcher fetcher, String baseUrl) {
        this.fetcher = fetcher;
        this.baseUrl = baseUrl;
    }

    public FetchOutcome<List<TrendingCoin>> trending() {
        FetchOutcome<JsonNode> response = fetcher.fetchJson(baseUrl + "/search/trending");

        List<TrendingCoin> coins = new ArrayList<>();
        for (JsonNode entry : response.value().path("coins")) {
            JsonNode item = entry.has("item") ? entry.get("item") : entry;
            String id = JsonFields.text(item, "id");
            if (id.isEmpty()) continue;

            coins.add(new TrendingCoin(
                id,
                JsonFields.text(item, "name"),
                JsonFields.text(item, "symbol"),
                JsonFields.integerOrNull(item, "market_cap_rank"),
                JsonFields.text(item, "thumb"),
                item.path("score").asInt(0),
                JsonFields.number(item, "price_btc")
            ));
        }

        log.debug("Trending: {} coins", coins.size());
        return listOutcome(coins, response);
    }

    public FetchOutcome<List<CoinMarket>> markets(int limit, int page, SortOrder order) {
        if (limit <= 0 || page <= 0) {
            return FetchOutcome.empty(List.of(), "limit and page must be positive");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("vs_currency", "usd");
        params.put("order", order.getUpstreamValue());
        params.put("per_page", String.valueOf(Math.min(limit, MAX_PER_PAGE)));
        params.put("page", String.valueOf(page));
        params.put("sparkline", "false");
        params.put("price_change_percentage", "24h,7d");

        FetchOutcome<JsonNode> response = fetcher.fetchJson(baseUrl + "/coins/markets", params);

        List<CoinMarket> coins = new ArrayList<>();
        for (JsonNode coin : response.value()) {
            String id = JsonFields.text(coin, "id");
            if (id.isEmpty()) continue;

            coins.add(new CoinMarket(
                id,
                JsonFields.text(coin, "symbol"),
                JsonFields.text(coin, "name"),
                JsonFields.text(coin, "image"),
                JsonFields.number(coin, "current_price"),
                JsonFields.number(coin, "market_cap"),
                JsonFields.integerOrNull(coin, "market_cap_rank"),
                JsonFields.number(coin, "total_volume"),
                JsonFields.number(coin, "high_24h"),
                JsonFields.number(coin, "low_24h"),
                JsonFields.number(coin, "price_change_24h"),
                JsonFields.number(coin, "price_change_percentage_24h"),
                JsonFields.number(coin, "price_change_percentage_7d_in_currency"),
                JsonFields.number(coin, "circulating_supply"),
                JsonFields.text(coin, "last_updated")
            ));
        }

        log.debug("Markets page {} ({}): {} coins", page, order, coins.size());
        return listOutcome(coins, response);
    }

    public FetchOutcome<SearchResults> search(String query) {
        if (query == null || query.isBlank()) {
            return FetchOutcome.empty(SearchResults.empty(), "blank query");
        }

        FetchOutcome<JsonNode> response = fetcher.fetchJson(baseUrl + "/search", Map.of("query", query.trim()));
        JsonNode root = response.value();

        List<SearchHit> coins = new ArrayList<>();
        for (JsonNode coin : root.path("coins")) {
            coins.add(new SearchHit(
                JsonFields.text(coin, "id"),
                JsonFields.text(coin, "name"),
                JsonFields.text(coin, "symbol"),
                JsonFields.integerOrNull(coin, "market_cap_rank"),
                JsonFields.text(coin, "thumb")
            ));
        }

        List<SearchHit> exchanges = new ArrayList<>();
        for (JsonNode exchange : root.path("exchanges")) {
            exchanges.add(new SearchHit(
                JsonFields.text(exchange, "id"),
                JsonFields.text(exchange, "name"),
                "",
                null,
                JsonFields.text(exchange, "thumb")
            ));
        }

        List<String> categories = new ArrayList<>();
        for (JsonNode category : root.path("categories")) {
            String name = JsonFields.text(category, "name");
            if (!name.isEmpty()) {
                categories.add(name);
            }
        }

        SearchResults results = new SearchResults(coins, exchanges, categories);
        if (!response.hasData()) {
            return FetchOutcome.empty(results, response.detail());
        }
        // An answered search with no matches is a valid result
        return FetchOutcome.data(results);
    }

    /**
     * Price quotes for exactly the requested coins. Coins the provider does not
     * return are left out of the map rather than defaulted.
     */
    public FetchOutcome<Map<String, PriceQuote>> simplePrices(Collection<String> coinIds, String currency) {
        if (coinIds.isEmpty()) {
            return FetchOutcome.empty(Map.of(), "no coins requested");
        }
        String vs = currency.toLowerCase(Locale.ROOT);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("ids", String.join(",", coinIds));
        params.put("vs_currencies", vs);
        params.put("include_24hr_change", "true");
        params.put("include_market_cap", "true");
        params.put("include_24hr_vol", "true");

        FetchOutcome<JsonNode> response = fetcher.fetchJson(baseUrl + "/simple/price", params);
        JsonNode root = response.value();

        Map<String, PriceQuote> quotes = new LinkedHashMap<>();
        for (String coinId : coinIds) {
            JsonNode row = root.path(coinId);
            OptionalDouble price = JsonFields.optionalNumber(row, vs);
            if (price.isEmpty()) {
                log.debug("No {} price for {}", vs, coinId);
                continue;
            }
            quotes.put(coinId, new PriceQuote(
                coinId,
                vs,
                price.getAsDouble(),
                JsonFields.number(row, vs + "_24h_change"),
                JsonFields.number(row, vs + "_market_cap"),
                JsonFields.number(row, vs + "_24h_vol")
            ));
        }

        if (quotes.isEmpty()) {
            return FetchOutcome.empty(Map.of(), response.hasData() ? "no requested coin priced" : response.detail());
        }
        return FetchOutcome.data(quotes);
    }

    private static <T> FetchOutcome<List<T>> listOutcome(List<T> items, FetchOutcome<JsonNode> response) {
        if (items.isEmpty()) {
            return FetchOutcome.empty(List.of(), response.hasData() ? "no items in response" : response.detail());
        }
        return FetchOutcome.data(List.copyOf(items));
    }
}
