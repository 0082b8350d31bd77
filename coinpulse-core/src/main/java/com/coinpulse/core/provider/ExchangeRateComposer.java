package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.model.ConversionTable;
import com.coinpulse.core.model.FiatCurrency;
import com.coinpulse.core.model.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the coin-to-fiat conversion table from USD prices and a fiat snapshot.
 *
 * Rows always carry "usd". EUR and GBP are rounded to 4 decimals, JPY to 2.
 * A coin without a USD price is left out. A fiat currency missing from the
 * snapshot is left out of every row and the result is marked PARTIAL.
 */
public class ExchangeRateComposer {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRateComposer.class);

    public static final List<String> REFERENCE_COINS =
        List.of("bitcoin", "ethereum", "binancecoin", "cardano", "solana");

    public FetchOutcome<ConversionTable> compose(Map<String, PriceQuote> usdPrices,
                                                 FetchOutcome<Map<String, Double>> fiatSnapshot) {
        Map<String, Double> fiatRates = fiatSnapshot.value();
        List<FiatCurrency> missingFiat = new ArrayList<>();
        for (FiatCurrency fiat : FiatCurrency.values()) {
            Double rate = fiatRates.get(fiat.name());
            if (rate == null || !Double.isFinite(rate)) {
                missingFiat.add(fiat);
            }
        }
        if (!missingFiat.isEmpty()) {
            log.warn("Fiat rates missing for {}, omitting them from the table", missingFiat);
        }

        Map<String, Map<String, Double>> table = new LinkedHashMap<>();
        for (String coin : REFERENCE_COINS) {
            PriceQuote quote = usdPrices.get(coin);
            if (quote == null || !"usd".equals(quote.currency().toLowerCase(Locale.ROOT))
                    || !Double.isFinite(quote.value())) {
                log.warn("Unable to get USD price for {}", coin);
                continue;
            }

            double usd = quote.value();
            Map<String, Double> row = new LinkedHashMap<>();
            row.put("usd", usd);
            for (FiatCurrency fiat : FiatCurrency.values()) {
                if (!missingFiat.contains(fiat)) {
                    row.put(fiat.code(), round(usd * fiatRates.get(fiat.name()), fiat.getDecimals()));
                }
            }
            table.put(coin, row);
        }

        ConversionTable result = new ConversionTable(table);
        if (result.isEmpty()) {
            return FetchOutcome.empty(result, "no reference coin priced");
        }
        if (!missingFiat.isEmpty()) {
            return FetchOutcome.partial(result, "fiat rates missing: " + missingFiat);
        }
        return FetchOutcome.data(result);
    }

    static double round(double value, int decimals) {
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }
}
