package com.coinpulse.core.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Factory for the shared HTTP client and JSON mapper.
 *
 * Every provider adapter goes through the same pooled OkHttpClient; per-call
 * timeouts are layered on top with {@link OkHttpClient#newBuilder()}.
 */
public final class HttpClientFactory {

    private static final OkHttpClient SHARED_CLIENT;
    private static final ObjectMapper SHARED_MAPPER;

    static {
        SHARED_CLIENT = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(10, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();

        SHARED_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private HttpClientFactory() {
        // Prevent instantiation
    }

    /**
     * Get the shared OkHttpClient instance.
     */
    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    /**
     * Get the shared ObjectMapper instance.
     * Lenient about unknown properties since upstream payloads grow fields over time.
     */
    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
