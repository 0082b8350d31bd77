package com.coinpulse.core.model;

/**
 * One coin or exchange match from a search. {@code symbol} is empty for exchanges.
 */
public record SearchHit(
    String id,
    String name,
    String symbol,
    Integer marketCapRank,
    String thumb
) {
}
