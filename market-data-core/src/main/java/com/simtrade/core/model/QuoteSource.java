package com.simtrade.core.model;

/**
 * Provenance of a quote: either the upstream feed that produced it
 * or the cache tier it was served from.
 */
public enum QuoteSource {
    COINGECKO,
    KRAKEN,
    ALPHA_VANTAGE,
    MEMORY,
    SNAPSHOT,
    STORE;

    public boolean isUpstream() {
        return this == COINGECKO || this == KRAKEN || this == ALPHA_VANTAGE;
    }
}
