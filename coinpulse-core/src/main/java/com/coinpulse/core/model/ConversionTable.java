package com.coinpulse.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Coin id -> (currency code -> value of one coin in that currency).
 * Currency codes are lower-case ("usd", "eur", ...). Iteration follows insertion order.
 */
public record ConversionTable(Map<String, Map<String, Double>> rates) {

    public ConversionTable {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        rates.forEach((coin, row) -> copy.put(coin, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
        rates = Collections.unmodifiableMap(copy);
    }

    public static ConversionTable empty() {
        return new ConversionTable(Map.of());
    }

    public Optional<Double> rate(String coinId, String currency) {
        Map<String, Double> row = rates.get(coinId.toLowerCase(Locale.ROOT));
        if (row == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(row.get(currency.toLowerCase(Locale.ROOT)));
    }

    public boolean isEmpty() {
        return rates.isEmpty();
    }

    public int size() {
        return rates.size();
    }
}
