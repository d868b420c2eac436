package com.simtrade.core.api;

import com.simtrade.core.model.Quote;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one provider fetch: the quotes obtained and the symbols that could not be priced.
 */
public record ProviderResult(Map<String, Quote> quotes, Set<String> failedSymbols) {

    public ProviderResult {
        quotes = Map.copyOf(quotes);
        failedSymbols = Set.copyOf(failedSymbols);
    }

    public static ProviderResult empty() {
        return new ProviderResult(Map.of(), Set.of());
    }

    public static ProviderResult failed(Collection<String> symbols) {
        return new ProviderResult(Map.of(), new HashSet<>(symbols));
    }

    public boolean isEmpty() {
        return quotes.isEmpty();
    }
}
