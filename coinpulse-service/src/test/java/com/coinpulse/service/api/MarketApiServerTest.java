package com.coinpulse.service.api;

import com.coinpulse.core.MarketAggregator;
import com.coinpulse.core.config.AggregatorConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end route tests: local upstream -> aggregator -> HTTP API.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class MarketApiServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient client = new OkHttpClient();

    private MockWebServer upstream;
    private MarketAggregator aggregator;
    private MarketApiServer server;

    @BeforeAll
    void startServers() throws IOException {
        upstream = new MockWebServer();
        upstream.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getRequestUrl() != null ? request.getRequestUrl().encodedPath() : "";
                switch (path) {
                    case "/coingecko/search/trending":
                        return json("{\"coins\":[{\"item\":{\"id\":\"pepe\",\"name\":\"Pepe\",\"symbol\":\"PEPE\",\"score\":0}}]}");
                    case "/coingecko/simple/price":
                        return json("{\"bitcoin\":{\"usd\":50000.0},\"ethereum\":{\"usd\":3000.0},"
                            + "\"binancecoin\":{\"usd\":600.0},\"cardano\":{\"usd\":0.5},\"solana\":{\"usd\":150.0}}");
                    case "/coingecko/coins/markets":
                        return json("[{\"id\":\"bitcoin\",\"symbol\":\"btc\",\"name\":\"Bitcoin\",\"current_price\":50000.0,\"market_cap_rank\":1}]");
                    case "/coingecko/search":
                        return json("{\"coins\":[{\"id\":\"solana\",\"name\":\"Solana\",\"symbol\":\"SOL\"}],\"exchanges\":[],\"categories\":[]}");
                    case "/cryptocompare/histoday":
                        return json("{\"Response\":\"Success\",\"Data\":{\"Data\":["
                            + "{\"time\":1700000000,\"close\":100.0,\"volumefrom\":2.0,\"volumeto\":200.0},"
                            + "{\"time\":1700086400,\"close\":110.0,\"volumefrom\":1.0,\"volumeto\":110.0}]}}");
                    case "/fiat/latest":
                        return json("{\"rates\":{\"EUR\":0.9,\"GBP\":0.8,\"JPY\":150.0}}");
                    default:
                        return new MockResponse().setResponseCode(500);
                }
            }
        });
        upstream.start();

        AggregatorConfig config = AggregatorConfig.builder()
            .allProvidersAt(upstream.url("/").toString())
            .feedSources(List.of())
            .fetchTimeout(Duration.ofSeconds(2))
            .maxAttempts(1)
            .build();
        aggregator = new MarketAggregator(config);
        server = new MarketApiServer(aggregator);
        server.start(0);
    }

    @AfterAll
    void stopServers() throws IOException {
        server.stop();
        aggregator.close();
        upstream.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private record Reply(int status, JsonNode body) {}

    private Reply get(String path) throws IOException {
        Request request = new Request.Builder().url("http://localhost:" + server.getPort() + path).build();
        try (Response response = client.newCall(request).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            return new Reply(response.code(), text.isEmpty() ? mapper.nullNode() : mapper.readTree(text));
        }
    }

    @Nested
    @DisplayName("Market routes")
    class MarketRoutes {

        @Test
        @DisplayName("GET /api/trending lists trending coins")
        void trending() throws IOException {
            Reply reply = get("/api/trending");

            assertEquals(200, reply.status());
            assertEquals("pepe", reply.body().path(0).path("id").asText());
        }

        @Test
        @DisplayName("GET /api/prices requires ids")
        void pricesRequireIds() throws IOException {
            Reply reply = get("/api/prices");

            assertEquals(400, reply.status());
            assertTrue(reply.body().path("error").asText().contains("ids"));
        }

        @Test
        @DisplayName("GET /api/prices returns quotes keyed by coin id")
        void prices() throws IOException {
            Reply reply = get("/api/prices?ids=bitcoin,ethereum");

            assertEquals(200, reply.status());
            assertEquals(50000.0, reply.body().path("bitcoin").path("value").asDouble());
            assertEquals("usd", reply.body().path("ethereum").path("currency").asText());
        }

        @Test
        @DisplayName("GET /api/markets validates limit and order")
        void marketsValidation() throws IOException {
            assertEquals(400, get("/api/markets?limit=0").status());
            assertEquals(400, get("/api/markets?limit=abc").status());
            assertEquals(400, get("/api/markets?order=alphabetical").status());

            Reply reply = get("/api/markets?limit=10&order=volume");
            assertEquals(200, reply.status());
            assertEquals("bitcoin", reply.body().path(0).path("id").asText());
        }

        @Test
        @DisplayName("GET /api/search echoes the query with grouped hits")
        void search() throws IOException {
            assertEquals(400, get("/api/search").status());

            Reply reply = get("/api/search?q=sol");
            assertEquals(200, reply.status());
            assertEquals("sol", reply.body().path("query").asText());
            assertEquals("solana", reply.body().path("coins").path(0).path("id").asText());
        }

        @Test
        @DisplayName("GET /api/history/{symbol} returns aligned pairs")
        void history() throws IOException {
            Reply reply = get("/api/history/btc?days=2");

            assertEquals(200, reply.status());
            assertEquals("BTC", reply.body().path("symbol").asText());
            assertEquals(2, reply.body().path("prices").size());
            assertEquals(1700000000000L, reply.body().path("prices").path(0).path(0).asLong());
            assertEquals(200.0, reply.body().path("marketCaps").path(0).path(1).asDouble());
            assertEquals(400, get("/api/history/btc?days=0").status());
        }

        @Test
        @DisplayName("GET /api/rates and /api/convert use the conversion table")
        void ratesAndConvert() throws IOException {
            Reply rates = get("/api/rates");
            assertEquals(200, rates.status());
            assertEquals(45000.0, rates.body().path("bitcoin").path("eur").asDouble());
            assertEquals(7500000.0, rates.body().path("bitcoin").path("jpy").asDouble());

            Reply conversion = get("/api/convert?from=ethereum&to=gbp&amount=2");
            assertEquals(200, conversion.status());
            assertEquals(4800.0, conversion.body().path("convertedAmount").asDouble());

            assertEquals(404, get("/api/convert?from=dogecoin&to=usd").status());
        }
    }

    @Nested
    @DisplayName("Insight routes")
    class InsightRoutes {

        @Test
        @DisplayName("GET /api/nfts without a key returns an empty list")
        void nftsWithoutKey() throws IOException {
            Reply reply = get("/api/nfts/0xabc");

            assertEquals(200, reply.status());
            assertTrue(reply.body().isArray());
            assertEquals(0, reply.body().size());
        }

        @Test
        @DisplayName("GET /api/news validates its limit")
        void newsLimit() throws IOException {
            assertEquals(400, get("/api/news?limit=101").status());

            Reply reply = get("/api/news?limit=5");
            assertEquals(200, reply.status());
            assertTrue(reply.body().isArray());
        }

        @Test
        @DisplayName("GET /api/sentiment is 404 while the index is unavailable")
        void sentimentUnavailable() throws IOException {
            Reply reply = get("/api/sentiment");

            assertEquals(404, reply.status());
            assertFalse(reply.body().path("error").asText().isEmpty());
        }
    }

    @Nested
    @DisplayName("Service routes")
    class ServiceRoutes {

        @Test
        @DisplayName("GET /health reports status")
        void health() throws IOException {
            Reply reply = get("/health");

            assertEquals(200, reply.status());
            assertEquals("ok", reply.body().path("status").asText());
            assertTrue(reply.body().has("cacheEntries"));
        }

        @Test
        @DisplayName("GET / describes the service")
        void info() throws IOException {
            Reply reply = get("/");

            assertEquals("CoinPulse", reply.body().path("name").asText());
            assertEquals(server.getPort(), reply.body().path("port").asInt());
        }
    }
}
