package com.simtrade.core.market;

import com.simtrade.core.cache.CacheTier;
import com.simtrade.core.cache.TieredQuoteCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resort for symbols no provider could price (or was allowed to price):
 * the long-lived store tier, even on a forced refresh.
 */
final class StaleStoreFallbackStep implements ResolutionStep {
    private static final Logger logger = LoggerFactory.getLogger(StaleStoreFallbackStep.class);

    private final TieredQuoteCache cache;
    private final ResolverCounters counters;

    StaleStoreFallbackStep(TieredQuoteCache cache, ResolverCounters counters) {
        this.cache = cache;
        this.counters = counters;
    }

    @Override
    public String name() {
        return "stale-store";
    }

    @Override
    public void resolve(ResolutionContext context) {
        for (String symbol : context.pending()) {
            cache.getFromTier(CacheTier.STORE, symbol).ifPresent(quote -> {
                counters.fallbackHit();
                context.resolve(symbol, quote);
            });
        }
        if (!context.isComplete()) {
            logger.debug("No stored quote for {}", context.pending());
        }
    }
}
