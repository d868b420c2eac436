package com.simtrade.core.market;

import com.simtrade.core.api.QuoteProvider;
import com.simtrade.core.api.RateGovernor;
import com.simtrade.core.cache.TieredQuoteCache;
import com.simtrade.core.model.Quote;
import com.simtrade.core.model.Symbols;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Resolves batches of symbols to trustworthy quotes while keeping upstream calls to a minimum.
 *
 * Resolution runs an ordered chain of steps, each pricing what it can:
 * <ol>
 *   <li>tiered cache (skipped on forced refresh)</li>
 *   <li>one step per provider, in configured order, gated by the rate governor</li>
 *   <li>long-lived store tier as the stale-but-acceptable fallback</li>
 * </ol>
 * Whatever is left is reported as unresolved; no price is ever synthesised.
 *
 * Timestamps delivered for a symbol never go backwards: if a step produces a
 * quote older than one already handed out, the newer one is returned instead.
 */
public final class PriceResolver implements QuoteService {
    private static final Logger logger = LoggerFactory.getLogger(PriceResolver.class);

    public static final int DEFAULT_MAX_SYMBOLS_PER_BATCH = 20;

    private final TieredQuoteCache cache;
    private final List<QuoteProvider> providers;
    private final List<ResolutionStep> steps;
    private final ResolverCounters counters;
    private final Executor executor;
    private final Map<String, Quote> lastDelivered = new ConcurrentHashMap<>();

    public PriceResolver(TieredQuoteCache cache, RateGovernor governor, List<QuoteProvider> providers,
                         int maxSymbolsPerBatch, MeterRegistry meterRegistry, Executor executor) {
        if (maxSymbolsPerBatch < 1) {
            throw new IllegalArgumentException("maxSymbolsPerBatch must be >= 1");
        }
        this.cache = cache;
        this.providers = List.copyOf(providers);
        this.counters = new ResolverCounters(meterRegistry);
        this.executor = executor;

        var chain = new ArrayList<ResolutionStep>();
        chain.add(new CacheLookupStep(cache, counters));
        for (QuoteProvider provider : this.providers) {
            chain.add(new ProviderFetchStep(provider, governor, cache, maxSymbolsPerBatch, counters));
        }
        chain.add(new StaleStoreFallbackStep(cache, counters));
        this.steps = List.copyOf(chain);

        logger.info("PriceResolver initialized: chain {}", steps.stream().map(ResolutionStep::name).toList());
    }

    @Override
    public QuoteBatch getQuotes(Collection<String> requested, boolean forceRefresh) {
        Set<String> symbols = Symbols.normalizeAll(requested);
        counters.request(symbols.size());
        if (symbols.isEmpty()) {
            return QuoteBatch.empty();
        }

        var context = new ResolutionContext(symbols, forceRefresh);
        for (ResolutionStep step : steps) {
            if (context.isComplete()) {
                break;
            }
            try {
                step.resolve(context);
            } catch (RuntimeException e) {
                counters.error(step.name());
                logger.warn("Resolution step {} failed: {}", step.name(), e.getMessage(), e);
            }
        }

        var quotes = new LinkedHashMap<String, Quote>();
        context.resolved().forEach((symbol, quote) -> quotes.put(symbol, deliver(symbol, quote)));

        Set<String> unresolved = context.pending();
        if (!unresolved.isEmpty()) {
            counters.unresolved(unresolved.size());
            logger.info("⚠️ Unresolved symbols: {}", unresolved);
        }
        logger.debug("Resolved {}/{} symbols (forceRefresh={})", quotes.size(), symbols.size(), forceRefresh);

        return new QuoteBatch(quotes, unresolved);
    }

    /**
     * Same as {@link #getQuotes(Collection, boolean)} on the resolver's executor.
     */
    public CompletableFuture<QuoteBatch> getQuotesAsync(Collection<String> symbols, boolean forceRefresh) {
        var copy = List.copyOf(symbols);
        return CompletableFuture.supplyAsync(() -> getQuotes(copy, forceRefresh), executor);
    }

    /**
     * Warm the cache in the background, e.g. for the instrument list shown on screen.
     */
    public CompletableFuture<Void> prefetch(Collection<String> symbols) {
        return getQuotesAsync(symbols, false)
            .thenAccept(batch -> logger.info("Prefetched {} quotes ({} unresolved)",
                batch.quotes().size(), batch.unresolvedSymbols().size()))
            .exceptionally(e -> {
                logger.warn("Prefetch failed: {}", e.getMessage());
                return null;
            });
    }

    private Quote deliver(String symbol, Quote candidate) {
        return lastDelivered.merge(symbol, candidate,
            (previous, next) -> next.timestamp() >= previous.timestamp() ? next : previous);
    }

    public void clearCache() {
        cache.clear();
        providers.forEach(QuoteProvider::clearCache);
    }

    public ResolverStats getStats() {
        return counters.snapshot(cache.stats());
    }

    public List<QuoteProvider> getProviders() {
        return providers;
    }
}
