package com.simtrade.core.market;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.simtrade.core.cache.TieredQuoteCache;

/**
 * Counters describing how requests were satisfied since startup (or the last reset).
 */
public record ResolverStats(
    long totalRequests,
    long symbolsRequested,
    long cacheHits,
    long providerCalls,
    long providerQuotes,
    long governorDenials,
    long fallbackHits,
    long unresolved,
    long errors,
    TieredQuoteCache.CacheStats cache
) {
    /**
     * Share of requested symbols served from cache or fallback, in percent.
     */
    @JsonProperty("cacheHitRate")
    public double cacheHitRate() {
        return symbolsRequested == 0 ? 0.0 : (cacheHits + fallbackHits) * 100.0 / symbolsRequested;
    }
}
