package com.coinpulse.service;

import com.coinpulse.core.MarketAggregator;
import com.coinpulse.core.config.AggregatorConfig;
import com.coinpulse.service.api.MarketApiServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * CoinPulse service - JSON API over the market aggregation layer.
 *
 * Configuration comes from system properties and environment variables,
 * see {@link AggregatorConfig#load()}.
 */
public class MarketServiceApp {
    private static final Logger LOG = LoggerFactory.getLogger(MarketServiceApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private static MarketAggregator aggregator;
    private static MarketApiServer server;

    public static void main(String[] args) {
        LOG.info("Starting CoinPulse service...");

        try {
            AggregatorConfig config = AggregatorConfig.load();
            if (config.getOpenSeaApiKey().isEmpty()) {
                LOG.info("No OpenSea API key configured, NFT queries will return empty results");
            }
            if (config.getCryptoPanicApiKey().isEmpty()) {
                LOG.info("No CryptoPanic API key configured, news-aggregator queries will return empty results");
            }

            aggregator = new MarketAggregator(config);
            server = new MarketApiServer(aggregator);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down CoinPulse service...");
                cleanup();
                shutdownLatch.countDown();
            }));

            server.start(config.getPort());
            LOG.info("CoinPulse service started on port {} (cache TTL {}s)",
                server.getPort(), config.getCacheTtl().toSeconds());

            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cleanup();
        } catch (Exception e) {
            LOG.error("Failed to start CoinPulse service", e);
            cleanup();
            System.exit(1);
        }
    }

    private static synchronized void cleanup() {
        if (server != null) {
            server.stop();
            server = null;
        }
        if (aggregator != null) {
            aggregator.close();
            aggregator = null;
        }
    }
}
