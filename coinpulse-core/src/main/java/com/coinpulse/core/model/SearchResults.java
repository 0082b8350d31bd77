package com.coinpulse.core.model;

import java.util.List;

public record SearchResults(
    List<SearchHit> coins,
    List<SearchHit> exchanges,
    List<String> categories
) {
    public SearchResults {
        coins = List.copyOf(coins);
        exchanges = List.copyOf(exchanges);
        categories = List.copyOf(categories);
    }

    public static SearchResults empty() {
        return new SearchResults(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return coins.isEmpty() && exchanges.isEmpty() && categories.isEmpty();
    }
}
