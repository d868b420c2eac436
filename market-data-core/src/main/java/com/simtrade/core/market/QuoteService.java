package com.simtrade.core.market;

import com.simtrade.core.model.Quote;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read side of market data as seen by the trading engine.
 */
public interface QuoteService {

    /**
     * Resolve quotes for a batch of symbols. Never throws for upstream
     * trouble; symbols that cannot be priced come back as unresolved.
     */
    QuoteBatch getQuotes(Collection<String> symbols, boolean forceRefresh);

    default QuoteBatch getQuotes(Collection<String> symbols) {
        return getQuotes(symbols, false);
    }

    default Optional<Quote> getQuote(String symbol) {
        return getQuotes(List.of(symbol), false).get(symbol);
    }
}
