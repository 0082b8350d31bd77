package com.coinpulse.core.model;

import java.util.List;

/**
 * Daily history as three index-aligned series in ascending time order.
 * Days without upstream data are omitted, never interpolated.
 *
 * {@code marketCaps} is approximated as {@code volumeFrom * close}; it is not a true
 * market capitalization.
 */
public record HistorySeries(
    List<SeriesPoint> prices,
    List<SeriesPoint> marketCaps,
    List<SeriesPoint> totalVolumes
) {
    public HistorySeries {
        prices = List.copyOf(prices);
        marketCaps = List.copyOf(marketCaps);
        totalVolumes = List.copyOf(totalVolumes);
    }

    public static HistorySeries empty() {
        return new HistorySeries(List.of(), List.of(), List.of());
    }

    public int size() {
        return prices.size();
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }
}
