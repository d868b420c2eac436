package com.simtrade.core.market;

import com.simtrade.core.model.Quote;
import com.simtrade.core.model.Symbols;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of a resolution: quotes keyed by normalised symbol and the symbols
 * nobody could price. Unresolved symbols are never given a synthetic price.
 */
public record QuoteBatch(Map<String, Quote> quotes, Set<String> unresolvedSymbols) {

    public QuoteBatch {
        quotes = Map.copyOf(quotes);
        unresolvedSymbols = Set.copyOf(unresolvedSymbols);
    }

    public static QuoteBatch empty() {
        return new QuoteBatch(Map.of(), Set.of());
    }

    public Optional<Quote> get(String symbol) {
        return Optional.ofNullable(quotes.get(Symbols.normalize(symbol)));
    }

    public boolean isComplete() {
        return unresolvedSymbols.isEmpty();
    }
}
