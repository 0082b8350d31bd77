package com.coinpulse.core.model;

public record SeriesPoint(long timestampMillis, double value) {
}
