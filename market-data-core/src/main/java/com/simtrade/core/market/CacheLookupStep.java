package com.simtrade.core.market;

import com.simtrade.core.cache.TieredQuoteCache;

/**
 * Serve pending symbols from the tiered cache. Skipped on a forced refresh.
 */
final class CacheLookupStep implements ResolutionStep {

    private final TieredQuoteCache cache;
    private final ResolverCounters counters;

    CacheLookupStep(TieredQuoteCache cache, ResolverCounters counters) {
        this.cache = cache;
        this.counters = counters;
    }

    @Override
    public String name() {
        return "cache";
    }

    @Override
    public void resolve(ResolutionContext context) {
        if (context.forceRefresh()) {
            return;
        }
        for (String symbol : context.pending()) {
            cache.get(symbol).ifPresent(quote -> {
                counters.cacheHit();
                context.resolve(symbol, quote);
            });
        }
    }
}
