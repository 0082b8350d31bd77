package com.coinpulse.core.model;

public record TrendingCoin(
    String id,
    String name,
    String symbol,
    Integer marketCapRank,
    String thumb,
    int score,
    double priceBtc
) {
}
