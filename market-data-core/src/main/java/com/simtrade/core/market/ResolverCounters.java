package com.simtrade.core.market;

import com.simtrade.core.cache.TieredQuoteCache;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolution counters, mirrored into Micrometer.
 */
final class ResolverCounters {

    private final MeterRegistry registry;

    final AtomicLong totalRequests = new AtomicLong();
    final AtomicLong symbolsRequested = new AtomicLong();
    final AtomicLong cacheHits = new AtomicLong();
    final AtomicLong providerCalls = new AtomicLong();
    final AtomicLong providerQuotes = new AtomicLong();
    final AtomicLong governorDenials = new AtomicLong();
    final AtomicLong fallbackHits = new AtomicLong();
    final AtomicLong unresolved = new AtomicLong();
    final AtomicLong errors = new AtomicLong();

    ResolverCounters(MeterRegistry registry) {
        this.registry = registry;
    }

    void request(int symbols) {
        totalRequests.incrementAndGet();
        symbolsRequested.addAndGet(symbols);
        registry.counter("market.resolver.requests").increment();
    }

    void cacheHit() {
        cacheHits.incrementAndGet();
        registry.counter("market.resolver.cache.hits").increment();
    }

    void providerCall(String providerId, int quotesReturned) {
        providerCalls.incrementAndGet();
        providerQuotes.addAndGet(quotesReturned);
        registry.counter("market.resolver.provider.calls", "provider", providerId).increment();
    }

    void governorDenial(String providerId) {
        governorDenials.incrementAndGet();
        registry.counter("market.governor.denials", "provider", providerId).increment();
    }

    void fallbackHit() {
        fallbackHits.incrementAndGet();
        registry.counter("market.resolver.fallback.hits").increment();
    }

    void unresolved(int count) {
        unresolved.addAndGet(count);
        registry.counter("market.resolver.unresolved").increment(count);
    }

    void error(String step) {
        errors.incrementAndGet();
        registry.counter("market.resolver.errors", "step", step).increment();
    }

    ResolverStats snapshot(TieredQuoteCache.CacheStats cacheStats) {
        return new ResolverStats(totalRequests.get(), symbolsRequested.get(), cacheHits.get(),
            providerCalls.get(), providerQuotes.get(), governorDenials.get(), fallbackHits.get(),
            unresolved.get(), errors.get(), cacheStats);
    }
}
