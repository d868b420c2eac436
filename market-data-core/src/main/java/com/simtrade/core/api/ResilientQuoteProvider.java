package com.simtrade.core.api;

import com.simtrade.core.model.Quote;
import com.simtrade.core.model.Symbols;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Production wrapper for a {@link QuoteProvider} with resilience patterns.
 *
 * Features:
 * - Retry: exponential backoff with jitter and a capped delay, transient failures only
 * - Circuit Breaker: stops calling an upstream that keeps failing
 * - Adapter cache: absorbs repeated identical requests for a short window
 * - Retry permits: every retry is a new upstream request and must be granted first
 * - Metrics: call latency plus success/failure counters per provider
 *
 * This is a decorator: it never throws. Anything the delegate could not price
 * after the last attempt is reported as failed.
 */
public final class ResilientQuoteProvider implements QuoteProvider {
    private static final Logger logger = LoggerFactory.getLogger(ResilientQuoteProvider.class);

    private final QuoteProvider delegate;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final long adapterCacheTtlMs;
    private final BooleanSupplier retryPermit;
    private final Map<String, CachedQuote> adapterCache = new ConcurrentHashMap<>();

    public ResilientQuoteProvider(QuoteProvider delegate, ResilienceSettings settings,
                                  MeterRegistry meterRegistry, Clock clock) {
        this(delegate, settings, meterRegistry, clock, () -> true);
    }

    /**
     * @param retryPermit asked before each retry; a denial ends the call with the
     *                    symbols reported as failed
     */
    public ResilientQuoteProvider(QuoteProvider delegate, ResilienceSettings settings,
                                  MeterRegistry meterRegistry, Clock clock, BooleanSupplier retryPermit) {
        this.delegate = delegate;
        this.retryPermit = retryPermit;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.adapterCacheTtlMs = settings.adapterCacheTtl().toMillis();

        // Circuit Breaker: open after 50% failures over the last 10 calls
        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .waitDurationInOpenState(settings.breakerWaitInOpen())
            .permittedNumberOfCallsInHalfOpenState(2)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .recordException(e -> e instanceof ProviderException)
            .build();
        this.circuitBreaker = CircuitBreaker.of(delegate.id(), cbConfig);

        // Retry: only transient upstream failures, exponential backoff with jitter
        var retryConfig = RetryConfig.custom()
            .maxAttempts(settings.maxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                settings.initialBackoff().toMillis(),
                settings.backoffMultiplier(),
                settings.jitter(),
                settings.maxBackoff().toMillis()))
            .retryOnException(e -> e instanceof ProviderException pe && pe.isRetryable())
            .build();
        this.retry = Retry.of(delegate.id(), retryConfig);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.warn("Circuit breaker for {} changed: {}", delegate.id(), event.getStateTransition()));
        retry.getEventPublisher()
            .onRetry(event ->
                logger.debug("Retrying {} (attempt {}) after {}: {}", delegate.id(),
                    event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                    event.getLastThrowable() == null ? "?" : event.getLastThrowable().getMessage()));

        logger.info("ResilientQuoteProvider initialized for {}: {} attempts, backoff {}ms-{}ms, cache {}ms",
            delegate.id(), settings.maxAttempts(), settings.initialBackoff().toMillis(),
            settings.maxBackoff().toMillis(), adapterCacheTtlMs);
    }

    @Override
    public String id() {
        return delegate.id();
    }

    @Override
    public boolean isSupported(String symbol) {
        return delegate.isSupported(symbol);
    }

    @Override
    public int maxSymbolsPerRequest() {
        return delegate.maxSymbolsPerRequest();
    }

    @Override
    public Map<String, Quote> cachedQuotes(Set<String> symbols, boolean forceRefresh) {
        if (forceRefresh) {
            return Map.of();
        }
        long now = clock.millis();
        var quotes = new HashMap<String, Quote>();
        for (String symbol : Symbols.normalizeAll(symbols)) {
            CachedQuote cached = adapterCache.get(symbol);
            if (cached != null && now - cached.fetchedAt() <= adapterCacheTtlMs) {
                quotes.put(symbol, cached.quote());
            }
        }
        return quotes;
    }

    @Override
    public ProviderResult fetchQuotes(Set<String> symbols) {
        return fetchQuotes(symbols, false);
    }

    @Override
    public ProviderResult fetchQuotes(Set<String> symbols, boolean forceRefresh) {
        Set<String> requested = Symbols.normalizeAll(symbols);
        var quotes = new HashMap<String, Quote>(cachedQuotes(requested, forceRefresh));
        var pending = new LinkedHashSet<String>(requested);
        pending.removeAll(quotes.keySet());

        if (pending.isEmpty()) {
            meterRegistry.counter("market.provider.cache.hits", "provider", id()).increment(requested.size());
            return new ProviderResult(quotes, Set.of());
        }

        ProviderResult fetched = executeResilient(pending);
        long fetchedAt = clock.millis();
        fetched.quotes().forEach((symbol, quote) -> {
            if (pending.contains(symbol)) {
                quotes.put(symbol, quote);
                adapterCache.put(symbol, new CachedQuote(quote, fetchedAt));
            }
        });

        var failed = new HashSet<String>();
        for (String symbol : requested) {
            if (!quotes.containsKey(symbol)) {
                failed.add(symbol);
            }
        }
        return new ProviderResult(quotes, failed);
    }

    /**
     * Execute the upstream call with full resilience: retry -> circuit breaker -> metrics.
     */
    private ProviderResult executeResilient(Set<String> symbols) {
        var timer = Timer.builder("market.provider.call")
            .tag("provider", id())
            .register(meterRegistry);

        return timer.record(() -> {
            try {
                var guarded = CircuitBreaker.decorateSupplier(circuitBreaker, () -> delegate.fetchQuotes(symbols));
                var attempts = new AtomicInteger();
                var decorated = Retry.decorateSupplier(retry, () -> {
                    if (attempts.getAndIncrement() > 0 && !retryPermit.getAsBoolean()) {
                        throw new ProviderException(id(), "rate budget exhausted, not retrying", false);
                    }
                    return guarded.get();
                });

                ProviderResult result = decorated.get();
                meterRegistry.counter("market.provider.success", "provider", id()).increment();
                return result;

            } catch (CallNotPermittedException e) {
                meterRegistry.counter("market.provider.failure",
                    "provider", id(), "error", "CircuitOpen").increment();
                logger.debug("Circuit open for {}, skipping {} symbols", id(), symbols.size());
                return ProviderResult.failed(symbols);

            } catch (RuntimeException e) {
                meterRegistry.counter("market.provider.failure",
                    "provider", id(), "error", e.getClass().getSimpleName()).increment();
                logger.warn("Provider {} failed for {} after retries: {}", id(), symbols, e.getMessage());
                return ProviderResult.failed(symbols);
            }
        });
    }

    @Override
    public void clearCache() {
        adapterCache.clear();
        delegate.clearCache();
    }

    /**
     * Get current circuit breaker state for health checks.
     */
    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    /**
     * Manually reset the circuit breaker.
     */
    public void resetCircuitBreaker() {
        logger.info("🔄 Manual circuit breaker reset requested for {}", id());
        circuitBreaker.reset();
    }

    private record CachedQuote(Quote quote, long fetchedAt) {
    }
}
