package com.simtrade.core.market;

import com.simtrade.core.api.ProviderResult;
import com.simtrade.core.api.QuoteProvider;
import com.simtrade.core.api.RateGovernor;
import com.simtrade.core.cache.TieredQuoteCache;
import com.simtrade.core.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ask one provider for the pending symbols it supports.
 *
 * Symbols the adapter can answer from its own short-lived cache are taken
 * first and cost nothing. The rest go upstream in batches no larger than one
 * request of the provider, and each batch needs a permit from the rate
 * governor. On denial the remaining symbols stay pending for later steps;
 * fetched quotes are written through to the cache.
 */
final class ProviderFetchStep implements ResolutionStep {
    private static final Logger logger = LoggerFactory.getLogger(ProviderFetchStep.class);

    private final QuoteProvider provider;
    private final RateGovernor governor;
    private final TieredQuoteCache cache;
    private final int maxSymbolsPerBatch;
    private final ResolverCounters counters;

    ProviderFetchStep(QuoteProvider provider, RateGovernor governor, TieredQuoteCache cache,
                      int maxSymbolsPerBatch, ResolverCounters counters) {
        this.provider = provider;
        this.governor = governor;
        this.cache = cache;
        this.maxSymbolsPerBatch = maxSymbolsPerBatch;
        this.counters = counters;
    }

    @Override
    public String name() {
        return "provider:" + provider.id();
    }

    @Override
    public void resolve(ResolutionContext context) {
        var supported = new ArrayList<String>();
        for (String symbol : context.pending()) {
            if (provider.isSupported(symbol)) {
                supported.add(symbol);
            }
        }
        if (supported.isEmpty()) {
            return;
        }

        Map<String, Quote> local = provider.cachedQuotes(new LinkedHashSet<>(supported), context.forceRefresh());
        local.forEach(context::resolve);
        supported.removeAll(local.keySet());
        if (supported.isEmpty()) {
            return;
        }

        int batchSize = Math.max(1, Math.min(maxSymbolsPerBatch, provider.maxSymbolsPerRequest()));
        for (Set<String> batch : partition(supported, batchSize)) {
            if (!governor.tryAcquire(provider.id())) {
                counters.governorDenial(provider.id());
                logger.debug("⏳ {} rate budget exhausted, leaving {} symbols for fallback", provider.id(), batch.size());
                return;
            }

            ProviderResult result = provider.fetchQuotes(batch, context.forceRefresh());
            counters.providerCall(provider.id(), result.quotes().size());

            result.quotes().forEach((symbol, quote) -> {
                if (batch.contains(symbol)) {
                    cache.put(symbol, quote);
                    context.resolve(symbol, quote);
                }
            });

            if (!result.failedSymbols().isEmpty()) {
                logger.debug("{} could not price {}", provider.id(), result.failedSymbols());
            }
        }
    }

    static List<Set<String>> partition(List<String> symbols, int size) {
        var batches = new ArrayList<Set<String>>();
        for (int i = 0; i < symbols.size(); i += size) {
            batches.add(new LinkedHashSet<>(symbols.subList(i, Math.min(i + size, symbols.size()))));
        }
        return batches;
    }
}
