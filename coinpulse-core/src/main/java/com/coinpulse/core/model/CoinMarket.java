package com.coinpulse.core.model;

/**
 * Market snapshot of one coin from the markets listing. Missing numeric fields are 0,
 * a missing rank is null.
 */
public record CoinMarket(
    String id,
    String symbol,
    String name,
    String image,
    double currentPrice,
    double marketCap,
    Integer marketCapRank,
    double totalVolume,
    double high24h,
    double low24h,
    double priceChange24h,
    double priceChangePercentage24h,
    double priceChangePercentage7d,
    double circulatingSupply,
    String lastUpdated
) {
}
