package com.simtrade.core.model;

/**
 * A single price observation for one instrument.
 *
 * Quotes are immutable. A quote served from a cache tier keeps the prices and
 * timestamp of the upstream observation but carries the tier as its source and
 * is flagged as not real-time.
 */
public record Quote(
    String symbol,
    double price,
    double open,
    double high,
    double low,
    double close,
    double volume,
    double change,
    double changePercent,
    long timestamp,
    QuoteSource source,
    boolean realTime
) {
    public Quote {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Quote symbol is required");
        }
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("Quote price must be positive for " + symbol + ": " + price);
        }
        if (source == null) {
            throw new IllegalArgumentException("Quote source is required for " + symbol);
        }
        symbol = Symbols.normalize(symbol);
    }

    /**
     * Flat quote where open, high, low and close all equal the last price.
     */
    public static Quote of(String symbol, double price, QuoteSource source, long timestamp) {
        return new Quote(symbol, price, price, price, price, price, 0.0, 0.0, 0.0, timestamp, source, source.isUpstream());
    }

    /**
     * Copy of this quote as served by a cache tier.
     */
    public Quote asCached(QuoteSource tier) {
        return new Quote(symbol, price, open, high, low, close, volume, change, changePercent, timestamp, tier, false);
    }
}
