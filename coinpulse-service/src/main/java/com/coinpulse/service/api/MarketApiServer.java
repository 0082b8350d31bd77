package com.coinpulse.service.api;

import com.coinpulse.core.MarketAggregator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import io.javalin.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only JSON API over {@link MarketAggregator}.
 * One route per query function, plus health and service info.
 */
public class MarketApiServer {
    private static final Logger LOG = LoggerFactory.getLogger(MarketApiServer.class);

    private final MarketAggregator aggregator;
    private final ObjectMapper objectMapper;
    private final MarketHandler marketHandler;
    private final InsightHandler insightHandler;
    private Javalin app;

    public MarketApiServer(MarketAggregator aggregator) {
        this.aggregator = aggregator;
        this.objectMapper = createObjectMapper();
        this.marketHandler = new MarketHandler(aggregator);
        this.insightHandler = new InsightHandler(aggregator);
    }

    private ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Start listening. Port 0 picks a free port; see {@link #getPort()}.
     */
    public void start(int port) {
        app = Javalin.create(javalinConfig -> {
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
            javalinConfig.showJavalinBanner = false;
        });

        configureErrorHandling();
        configureMarketRoutes();
        configureInsightRoutes();
        configureHealthRoutes();

        app.start(port);
        LOG.info("Market API listening on port {}", app.port());
    }

    public int getPort() {
        return app != null ? app.port() : -1;
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    private void configureErrorHandling() {
        app.exception(ValidationException.class, (e, ctx) ->
            ctx.status(400).json(new ErrorResponse("Invalid parameter: " + String.join(", ", e.getErrors().keySet()))));

        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Request {} {} failed", ctx.method(), ctx.path(), e);
            ctx.status(500).json(new ErrorResponse(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        });
    }

    private void configureMarketRoutes() {
        app.get("/api/trending", marketHandler::trending);
        app.get("/api/prices", marketHandler::prices);
        app.get("/api/markets", marketHandler::markets);
        app.get("/api/search", marketHandler::search);
        app.get("/api/history/{symbol}", marketHandler::history);
        app.get("/api/rates", marketHandler::rates);
        app.get("/api/convert", marketHandler::convert);
    }

    private void configureInsightRoutes() {
        app.get("/api/news", insightHandler::news);
        app.get("/api/news/posts", insightHandler::posts);
        app.get("/api/nfts/{address}", insightHandler::nfts);
        app.get("/api/sentiment", insightHandler::sentiment);
    }

    private void configureHealthRoutes() {
        app.get("/health", ctx -> ctx.json(new HealthResponse("ok", aggregator.cacheSize())));
        app.get("/", ctx -> ctx.json(new ServiceInfo("CoinPulse", "1.0.0", app.port())));
    }

    // Response records
    public record HealthResponse(String status, int cacheEntries) {}
    public record ServiceInfo(String name, String version, int port) {}
}
