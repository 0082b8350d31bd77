package com.coinpulse.core.model;

/**
 * Spot price of one coin in one currency, with 24h statistics.
 */
public record PriceQuote(
    String coinId,
    String currency,
    double value,
    double change24h,       // percent
    double marketCap,
    double volume24h
) {
}
