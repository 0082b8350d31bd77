package com.coinpulse.core.http;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of an upstream call. The value is never null: an empty outcome
 * carries the caller's notion of "nothing" (empty list, empty map, empty node).
 *
 * @param value  payload, possibly empty
 * @param status whether the payload is complete, degraded or empty
 * @param detail short explanation for logs, empty for complete results
 */
public record FetchOutcome<T>(T value, Status status, String detail) {

    public enum Status {
        /** Complete result, safe to cache. */
        DATA,
        /** Usable but degraded (some sources or inputs missing). Not cached. */
        PARTIAL,
        /** Nothing usable. Not cached. */
        EMPTY
    }

    public FetchOutcome {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(status, "status");
        detail = detail != null ? detail : "";
    }

    public static <T> FetchOutcome<T> data(T value) {
        return new FetchOutcome<>(value, Status.DATA, "");
    }

    public static <T> FetchOutcome<T> partial(T value, String detail) {
        return new FetchOutcome<>(value, Status.PARTIAL, detail);
    }

    public static <T> FetchOutcome<T> empty(T emptyValue, String detail) {
        return new FetchOutcome<>(emptyValue, Status.EMPTY, detail);
    }

    public boolean hasData() {
        return status != Status.EMPTY;
    }

    public boolean isCacheable() {
        return status == Status.DATA;
    }

    /**
     * Reshape the payload, keeping status and detail.
     */
    public <R> FetchOutcome<R> map(Function<? super T, ? extends R> mapper) {
        return new FetchOutcome<>(mapper.apply(value), status, detail);
    }
}
