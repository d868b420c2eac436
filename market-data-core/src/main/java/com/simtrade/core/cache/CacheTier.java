package com.simtrade.core.cache;

import com.simtrade.core.model.QuoteSource;

import java.time.Duration;

/**
 * Cache tiers, fastest first, with their default lifetimes.
 */
public enum CacheTier {
    MEMORY(Duration.ofMinutes(5), QuoteSource.MEMORY),
    SNAPSHOT(Duration.ofMinutes(30), QuoteSource.SNAPSHOT),
    STORE(Duration.ofMinutes(60), QuoteSource.STORE);

    private final Duration defaultTtl;
    private final QuoteSource source;

    CacheTier(Duration defaultTtl, QuoteSource source) {
        this.defaultTtl = defaultTtl;
        this.source = source;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    /**
     * Provenance tag given to quotes served from this tier.
     */
    public QuoteSource source() {
        return source;
    }
}
