package com.simtrade.core.api;

import com.simtrade.core.model.Quote;

import java.util.Map;
import java.util.Set;

/**
 * Adapter over one upstream price feed.
 *
 * Implementations never invent a price: a symbol that cannot be priced is
 * reported in {@link ProviderResult#failedSymbols()} rather than filled with a
 * placeholder. Raw adapters may throw {@link ProviderException} on transport
 * failures; {@link ResilientQuoteProvider} turns those into failed symbols.
 */
public interface QuoteProvider {

    /**
     * Stable identifier used for rate governance, metrics and logging.
     */
    String id();

    boolean isSupported(String symbol);

    ProviderResult fetchQuotes(Set<String> symbols);

    /**
     * Fetch with an explicit freshness requirement. Adapters without a local
     * cache ignore the flag.
     */
    default ProviderResult fetchQuotes(Set<String> symbols, boolean forceRefresh) {
        return fetchQuotes(symbols);
    }

    /**
     * How many symbols one upstream request can price. Every request costs one
     * rate permit, so the resolver never hands an adapter a larger batch.
     */
    default int maxSymbolsPerRequest() {
        return Integer.MAX_VALUE;
    }

    /**
     * Quotes the adapter can answer locally, without an upstream request.
     */
    default Map<String, Quote> cachedQuotes(Set<String> symbols, boolean forceRefresh) {
        return Map.of();
    }

    default void clearCache() {
    }
}
