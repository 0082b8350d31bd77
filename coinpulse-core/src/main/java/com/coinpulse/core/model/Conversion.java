package com.coinpulse.core.model;

public record Conversion(
    String fromCurrency,
    String toCurrency,
    double amount,
    double convertedAmount,
    double rate
) {
}
