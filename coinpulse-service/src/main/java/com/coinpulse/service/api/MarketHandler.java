package com.coinpulse.service.api;

import com.coinpulse.core.MarketAggregator;
import com.coinpulse.core.model.CoinMarket;
import com.coinpulse.core.model.Conversion;
import com.coinpulse.core.model.HistorySeries;
import com.coinpulse.core.model.SearchHit;
import com.coinpulse.core.model.SearchResults;
import com.coinpulse.core.model.SeriesPoint;
import com.coinpulse.core.model.SortOrder;
import io.javalin.http.Context;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * HTTP handler for price, market, history and conversion endpoints.
 */
public class MarketHandler {

    private static final int MAX_MARKET_LIMIT = 250;
    private static final int MAX_HISTORY_DAYS = 2000;

    private final MarketAggregator aggregator;

    public MarketHandler(MarketAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * GET /api/trending
     */
    public void trending(Context ctx) {
        ctx.json(aggregator.trendingCoins());
    }

    /**
     * GET /api/prices
     *
     * Query params:
     * - ids: comma-separated coin ids (required)
     * - currency: quote currency - default: usd
     */
    public void prices(Context ctx) {
        String ids = ctx.queryParam("ids");
        if (ids == null || ids.isBlank()) {
            ctx.status(400).json(new ErrorResponse("ids parameter is required"));
            return;
        }
        String currency = ctx.queryParamAsClass("currency", String.class).getOrDefault("usd");

        List<String> coinIds = Arrays.stream(ids.split(","))
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .toList();
        ctx.json(aggregator.coinPrices(coinIds, currency));
    }

    /**
     * GET /api/markets
     *
     * Query params:
     * - limit: coins per page (1-250) - default: 50
     * - page: 1-based page - default: 1
     * - order: market_cap | volume | price_change - default: market_cap
     */
    public void markets(Context ctx) {
        int limit = ctx.queryParamAsClass("limit", Integer.class).getOrDefault(50);
        int page = ctx.queryParamAsClass("page", Integer.class).getOrDefault(1);
        String orderParam = ctx.queryParam("order");

        if (limit < 1 || limit > MAX_MARKET_LIMIT) {
            ctx.status(400).json(new ErrorResponse("limit must be between 1 and " + MAX_MARKET_LIMIT));
            return;
        }
        if (page < 1) {
            ctx.status(400).json(new ErrorResponse("page must be at least 1"));
            return;
        }

        SortOrder order = SortOrder.MARKET_CAP_DESC;
        if (orderParam != null && !orderParam.isBlank()) {
            Optional<SortOrder> parsed = SortOrder.parse(orderParam);
            if (parsed.isEmpty()) {
                ctx.status(400).json(new ErrorResponse("Unknown order: " + orderParam));
                return;
            }
            order = parsed.get();
        }

        List<CoinMarket> coins = aggregator.topCoins(limit, page, order);
        ctx.json(coins);
    }

    /**
     * GET /api/search?q=
     */
    public void search(Context ctx) {
        String query = ctx.queryParam("q");
        if (query == null || query.isBlank()) {
            ctx.status(400).json(new ErrorResponse("q parameter is required"));
            return;
        }
        SearchResults results = aggregator.searchCoins(query);
        ctx.json(new SearchResponse(query.trim(), results.coins(), results.exchanges(), results.categories()));
    }

    /**
     * GET /api/history/{symbol}?days=30
     * Series are returned as [timestampMillis, value] pairs.
     */
    public void history(Context ctx) {
        String symbol = ctx.pathParam("symbol");
        int days = ctx.queryParamAsClass("days", Integer.class).getOrDefault(30);
        if (days < 1 || days > MAX_HISTORY_DAYS) {
            ctx.status(400).json(new ErrorResponse("days must be between 1 and " + MAX_HISTORY_DAYS));
            return;
        }

        HistorySeries series = aggregator.coinHistory(symbol, days);
        ctx.json(new HistoryResponse(
            symbol.toUpperCase(Locale.ROOT),
            days,
            pairs(series.prices()),
            pairs(series.marketCaps()),
            pairs(series.totalVolumes())
        ));
    }

    /**
     * GET /api/rates
     */
    public void rates(Context ctx) {
        ctx.json(aggregator.exchangeRates().rates());
    }

    /**
     * GET /api/convert
     *
     * Query params:
     * - from: coin id - default: bitcoin
     * - to: currency code - default: usd
     * - amount: default: 1
     */
    public void convert(Context ctx) {
        String from = ctx.queryParamAsClass("from", String.class).getOrDefault("bitcoin");
        String to = ctx.queryParamAsClass("to", String.class).getOrDefault("usd");
        double amount = ctx.queryParamAsClass("amount", Double.class).getOrDefault(1.0);

        Optional<Conversion> conversion = aggregator.convert(from, to, amount);
        if (conversion.isEmpty()) {
            ctx.status(404).json(new ErrorResponse("No rate available for " + from + " -> " + to));
            return;
        }
        ctx.json(conversion.get());
    }

    private static List<List<Number>> pairs(List<SeriesPoint> points) {
        return points.stream()
            .map(p -> List.<Number>of(p.timestampMillis(), p.value()))
            .toList();
    }

    // Response records

    public record SearchResponse(
        String query,
        List<SearchHit> coins,
        List<SearchHit> exchanges,
        List<String> categories
    ) {}

    public record HistoryResponse(
        String symbol,
        int days,
        List<List<Number>> prices,
        List<List<Number>> marketCaps,
        List<List<Number>> totalVolumes
    ) {}
}
