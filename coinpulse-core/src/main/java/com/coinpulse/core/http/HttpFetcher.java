package com.coinpulse.core.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Provider-agnostic GET client with timeout, retry and 429 backoff.
 *
 * Retry policy per attempt:
 * - 429: wait 2 * (attempt + 1) seconds, then retry
 * - any other failure (transport, non-2xx, unparsable body): wait 1 second, then retry
 * - no wait after the final attempt
 *
 * Never throws for upstream failure. Exhausted attempts yield an EMPTY outcome
 * whose value is an empty JSON object.
 */
public class HttpFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Sleeper sleeper;
    private final int maxAttempts;

    public HttpFetcher() {
        this(HttpClientFactory.getClient(), HttpClientFactory.getMapper(), Sleeper.system(),
            DEFAULT_TIMEOUT, DEFAULT_MAX_ATTEMPTS);
    }

    public HttpFetcher(OkHttpClient client, ObjectMapper mapper, Sleeper sleeper,
                       Duration timeout, int maxAttempts) {
        this.client = client.newBuilder().callTimeout(timeout).build();
        this.mapper = mapper;
        this.sleeper = sleeper;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public FetchOutcome<JsonNode> fetchJson(String url) {
        return fetchJson(url, Map.of(), Map.of(), maxAttempts);
    }

    public FetchOutcome<JsonNode> fetchJson(String url, Map<String, String> query) {
        return fetchJson(url, query, Map.of(), maxAttempts);
    }

    public FetchOutcome<JsonNode> fetchJson(String url, Map<String, String> query, Map<String, String> headers) {
        return fetchJson(url, query, headers, maxAttempts);
    }

    /**
     * Fetch and parse a JSON document.
     *
     * @param url         absolute URL without query string parameters from {@code query}
     * @param query       query parameters, appended in iteration order
     * @param headers     extra request headers
     * @param maxAttempts total number of requests allowed, 429s included
     */
    public FetchOutcome<JsonNode> fetchJson(String url, Map<String, String> query,
                                            Map<String, String> headers, int maxAttempts) {
        Request request;
        try {
            request = buildRequest(url, query, headers);
        } catch (IllegalArgumentException e) {
            log.error("Invalid URL {}: {}", url, e.getMessage());
            return emptyJson("invalid url");
        }

        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 0; attempt < attempts; attempt++) {
            boolean lastAttempt = attempt == attempts - 1;
            try {
                return FetchOutcome.data(execute(request));
            } catch (RateLimitedException e) {
                Duration wait = Duration.ofSeconds(2L * (attempt + 1));
                if (lastAttempt) {
                    log.warn("Rate limited (429) by {} on final attempt {}/{}", request.url().host(), attempt + 1, attempts);
                    break;
                }
                log.warn("Rate limited (429) by {}. Retrying in {}s...", request.url().host(), wait.toSeconds());
                if (!pause(wait)) {
                    return emptyJson("interrupted");
                }
            } catch (IOException e) {
                log.error("Error fetching {} (attempt {}/{}): {}", redact(request.url()), attempt + 1, attempts, e.getMessage());
                if (!lastAttempt && !pause(ERROR_BACKOFF)) {
                    return emptyJson("interrupted");
                }
            }
        }

        log.error("Giving up on {} after {} attempts", redact(request.url()), attempts);
        return emptyJson("retries exhausted");
    }

    /**
     * Single best-effort download, used for feeds. Any non-200 answer or transport
     * failure yields an EMPTY outcome.
     */
    public FetchOutcome<byte[]> fetchBytes(String url, Duration callTimeout) {
        Request request;
        try {
            request = buildRequest(url, Map.of(), Map.of());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid feed URL {}: {}", url, e.getMessage());
            return FetchOutcome.empty(new byte[0], "invalid url");
        }

        OkHttpClient feedClient = client.newBuilder().callTimeout(callTimeout).build();
        try (Response response = feedClient.newCall(request).execute()) {
            if (response.code() != 200) {
                log.warn("Feed {} answered {}", url, response.code());
                return FetchOutcome.empty(new byte[0], "status " + response.code());
            }
            ResponseBody body = response.body();
            return FetchOutcome.data(body != null ? body.bytes() : new byte[0]);
        } catch (IOException e) {
            log.warn("Error downloading feed {}: {}", url, e.getMessage());
            return FetchOutcome.empty(new byte[0], e.getMessage());
        }
    }

    private JsonNode execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            if (response.code() == 429) {
                throw new RateLimitedException("429 from " + request.url().host());
            }
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " " + response.message());
            }
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (text.isBlank()) {
                throw new IOException("Empty response body");
            }
            // JsonProcessingException is an IOException, so malformed bodies are retried too
            return mapper.readTree(text);
        }
    }

    private Request buildRequest(String url, Map<String, String> query, Map<String, String> headers) {
        HttpUrl base = HttpUrl.get(url);
        HttpUrl.Builder urlBuilder = base.newBuilder();
        query.forEach(urlBuilder::addQueryParameter);

        Request.Builder builder = new Request.Builder()
            .url(urlBuilder.build())
            .header("Accept", "application/json")
            .get();
        headers.forEach(builder::header);
        return builder.build();
    }

    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while backing off, abandoning request");
            return false;
        }
    }

    private FetchOutcome<JsonNode> emptyJson(String detail) {
        return FetchOutcome.empty(mapper.createObjectNode(), detail);
    }

    // Keeps API tokens passed as query parameters out of the logs
    private static String redact(HttpUrl url) {
        if (url.queryParameter("auth_token") == null) {
            return url.toString();
        }
        return url.newBuilder().setQueryParameter("auth_token", "***").build().toString();
    }
}
