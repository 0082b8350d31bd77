package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.model.ConversionTable;
import com.coinpulse.core.model.PriceQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeRateComposerTest {

    private final ExchangeRateComposer composer = new ExchangeRateComposer();

    private static PriceQuote usd(String coin, double price) {
        return new PriceQuote(coin, "usd", price, 0, 0, 0);
    }

    private static Map<String, PriceQuote> fourOfFive() {
        Map<String, PriceQuote> prices = new LinkedHashMap<>();
        prices.put("bitcoin", usd("bitcoin", 50000.0));
        prices.put("ethereum", usd("ethereum", 3000.123456));
        prices.put("cardano", usd("cardano", 0.5));
        prices.put("solana", usd("solana", 150.0));
        return prices;
    }

    @Test
    @DisplayName("Composes one row per priced reference coin with rounded fiat values")
    void composesTable() {
        FetchOutcome<Map<String, Double>> fiat = FetchOutcome.data(Map.of("EUR", 0.9, "GBP", 0.8, "JPY", 150.0));

        FetchOutcome<ConversionTable> outcome = composer.compose(fourOfFive(), fiat);

        assertEquals(FetchOutcome.Status.DATA, outcome.status());
        ConversionTable table = outcome.value();
        assertEquals(List.of("bitcoin", "ethereum", "cardano", "solana"), List.copyOf(table.rates().keySet()));
        assertFalse(table.rates().containsKey("binancecoin"));

        assertEquals(Map.of("usd", 50000.0, "eur", 45000.0, "gbp", 40000.0, "jpy", 7500000.0),
            table.rates().get("bitcoin"));
        assertEquals(Optional.of(2700.1111), table.rate("ethereum", "eur"));
        assertEquals(Optional.of(2400.0988), table.rate("ethereum", "gbp"));
        assertEquals(Optional.of(450018.52), table.rate("ethereum", "jpy"));
        assertEquals(Optional.of(0.45), table.rate("cardano", "EUR"));
    }

    @Test
    @DisplayName("Missing fiat currency is omitted and the table is partial")
    void missingFiat() {
        FetchOutcome<Map<String, Double>> fiat = FetchOutcome.data(Map.of("EUR", 0.9));

        FetchOutcome<ConversionTable> outcome = composer.compose(fourOfFive(), fiat);

        assertEquals(FetchOutcome.Status.PARTIAL, outcome.status());
        assertEquals(Map.of("usd", 150.0, "eur", 135.0), outcome.value().rates().get("solana"));
        assertTrue(outcome.value().rate("solana", "jpy").isEmpty());
    }

    @Test
    @DisplayName("Non-finite price skips only that coin")
    void nonFinitePriceSkipsCoin() {
        Map<String, PriceQuote> prices = fourOfFive();
        prices.put("cardano", usd("cardano", Double.NaN));
        prices.put("solana", usd("solana", Double.POSITIVE_INFINITY));

        FetchOutcome<ConversionTable> outcome = composer.compose(prices,
            FetchOutcome.data(Map.of("EUR", 0.9, "GBP", 0.8, "JPY", 150.0)));

        assertEquals(FetchOutcome.Status.DATA, outcome.status());
        assertEquals(List.of("bitcoin", "ethereum"), List.copyOf(outcome.value().rates().keySet()));
    }

    @Test
    @DisplayName("No priced coin gives an empty table")
    void nothingPriced() {
        FetchOutcome<ConversionTable> outcome = composer.compose(Map.of(),
            FetchOutcome.data(Map.of("EUR", 0.9, "GBP", 0.8, "JPY", 150.0)));

        assertEquals(FetchOutcome.Status.EMPTY, outcome.status());
        assertTrue(outcome.value().isEmpty());
    }

    @Test
    @DisplayName("Rounds half up")
    void roundsHalfUp() {
        assertEquals(0.1235, ExchangeRateComposer.round(0.12345, 4));
        assertEquals(1.01, ExchangeRateComposer.round(1.005, 2));
    }
}
