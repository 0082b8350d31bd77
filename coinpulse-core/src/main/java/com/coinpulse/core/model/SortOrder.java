package com.coinpulse.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordering for the markets listing, passed through to the provider.
 */
public enum SortOrder {
    MARKET_CAP_DESC("market_cap", "market_cap_desc"),
    VOLUME_DESC("volume", "volume_desc"),
    PRICE_CHANGE_DESC("price_change", "price_change_percentage_24h_desc");

    private final String shortName;
    private final String upstreamValue;

    SortOrder(String shortName, String upstreamValue) {
        this.shortName = shortName;
        this.upstreamValue = upstreamValue;
    }

    public String getUpstreamValue() {
        return upstreamValue;
    }

    /**
     * Accepts the short name ("volume"), the upstream literal ("volume_desc")
     * or the enum name, case-insensitively.
     */
    public static Optional<SortOrder> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortOrder order : values()) {
            if (order.shortName.equals(normalized)
                || order.upstreamValue.equals(normalized)
                || order.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(order);
            }
        }
        return Optional.empty();
    }
}
