package com.coinpulse.core.model;

public record NftAsset(
    String identifier,
    String collection,
    String contract,
    String tokenStandard,
    String name,
    String description,
    String imageUrl,
    String openseaUrl
) {
}
