package com.coinpulse.service.api;

import com.coinpulse.core.MarketAggregator;
import com.coinpulse.core.model.SentimentReading;
import io.javalin.http.Context;

import java.util.Optional;

/**
 * HTTP handler for news, sentiment and NFT endpoints.
 */
public class InsightHandler {

    private static final int MAX_NEWS_LIMIT = 100;

    private final MarketAggregator aggregator;

    public InsightHandler(MarketAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * GET /api/news?limit=30
     */
    public void news(Context ctx) {
        int limit = ctx.queryParamAsClass("limit", Integer.class).getOrDefault(30);
        if (limit < 1 || limit > MAX_NEWS_LIMIT) {
            ctx.status(400).json(new ErrorResponse("limit must be between 1 and " + MAX_NEWS_LIMIT));
            return;
        }
        ctx.json(aggregator.news(limit));
    }

    /**
     * GET /api/news/posts?filter=news&currencies=BTC
     * Empty list when no news-aggregator API key is configured.
     */
    public void posts(Context ctx) {
        ctx.json(aggregator.newsPosts(ctx.queryParam("filter"), ctx.queryParam("currencies")));
    }

    /**
     * GET /api/nfts/{address}?chain=ethereum
     * Empty list when no NFT API key is configured.
     */
    public void nfts(Context ctx) {
        String chain = ctx.queryParamAsClass("chain", String.class).getOrDefault("ethereum");
        ctx.json(aggregator.nftsByWallet(ctx.pathParam("address"), chain));
    }

    /**
     * GET /api/sentiment
     */
    public void sentiment(Context ctx) {
        Optional<SentimentReading> reading = aggregator.sentimentIndex();
        if (reading.isEmpty()) {
            ctx.status(404).json(new ErrorResponse("Sentiment index unavailable"));
            return;
        }
        ctx.json(reading.get());
    }
}
