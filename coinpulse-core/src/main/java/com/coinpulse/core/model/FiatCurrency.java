package com.coinpulse.core.model;

import java.util.Locale;

/**
 * Fiat currencies in the conversion table, with the decimals each is rounded to.
 * USD is the baseline and is not listed.
 */
public enum FiatCurrency {
    EUR(4),
    GBP(4),
    JPY(2);

    private final int decimals;

    FiatCurrency(int decimals) {
        this.decimals = decimals;
    }

    public int getDecimals() {
        return decimals;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
