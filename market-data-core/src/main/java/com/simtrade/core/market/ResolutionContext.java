package com.simtrade.core.market;

import com.simtrade.core.model.Quote;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one resolution pass. Confined to the calling thread.
 */
final class ResolutionContext {

    private final boolean forceRefresh;
    private final Set<String> pending;
    private final Map<String, Quote> resolved = new LinkedHashMap<>();

    ResolutionContext(Collection<String> symbols, boolean forceRefresh) {
        this.pending = new LinkedHashSet<>(symbols);
        this.forceRefresh = forceRefresh;
    }

    boolean forceRefresh() {
        return forceRefresh;
    }

    /**
     * Snapshot of the symbols still waiting for a price.
     */
    Set<String> pending() {
        return new LinkedHashSet<>(pending);
    }

    boolean isComplete() {
        return pending.isEmpty();
    }

    void resolve(String symbol, Quote quote) {
        if (pending.remove(symbol)) {
            resolved.put(symbol, quote);
        }
    }

    Map<String, Quote> resolved() {
        return resolved;
    }
}
