package com.coinpulse.core.cache;

import java.util.Collection;
import java.util.Objects;

/**
 * Deterministic cache slot identifier derived from an operation name and its parameters.
 *
 * Parameters are length-prefixed ({@code s<len>:<text>}, lists as {@code l<size>[...]},
 * null as {@code n}) so two different parameter tuples can never encode to the same key.
 * Callers normalize order-insensitive parameters before building the key.
 */
public record CacheKey(String value) {

    public CacheKey {
        Objects.requireNonNull(value, "value");
    }

    public static CacheKey of(String operation, Object... params) {
        StringBuilder sb = new StringBuilder(Objects.requireNonNull(operation, "operation"));
        for (Object param : params) {
            sb.append('|');
            encode(sb, param);
        }
        return new CacheKey(sb.toString());
    }

    private static void encode(StringBuilder sb, Object param) {
        if (param == null) {
            sb.append('n');
        } else if (param instanceof Collection<?> items) {
            sb.append('l').append(items.size()).append('[');
            for (Object item : items) {
                encode(sb, item);
            }
            sb.append(']');
        } else {
            String text = param.toString();
            sb.append('s').append(text.length()).append(':').append(text);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
