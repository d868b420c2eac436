package com.simtrade.core.api;

import com.simtrade.core.MutableClock;
import com.simtrade.core.model.Quote;
import com.simtrade.core.model.QuoteSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResilientQuoteProvider Tests")
class ResilientQuoteProviderTest {

    private static final ResilienceSettings FAST = new ResilienceSettings(
        3, Duration.ofMillis(10), 2.0, Duration.ofMillis(40), 0.2, Duration.ofSeconds(30), Duration.ofSeconds(30));

    @Mock
    private QuoteProvider delegate;

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private ResilientQuoteProvider provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(100_000L);
        registry = new SimpleMeterRegistry();
        when(delegate.id()).thenReturn("coingecko");
        provider = new ResilientQuoteProvider(delegate, FAST, registry, clock);
    }

    private static ProviderResult btcResult(double price) {
        return new ProviderResult(Map.of("BTC", Quote.of("BTC", price, QuoteSource.COINGECKO, 1L)), Set.of());
    }

    @Test
    @DisplayName("Retries transient failures and then succeeds")
    void testRetryThenSuccess() {
        when(delegate.fetchQuotes(anySet()))
            .thenThrow(new ProviderException("coingecko", "HTTP 503", true))
            .thenReturn(btcResult(50000.0));

        var result = provider.fetchQuotes(Set.of("BTC"));

        assertThat(result.quotes()).containsKey("BTC");
        assertThat(result.failedSymbols()).isEmpty();
        verify(delegate, times(2)).fetchQuotes(anySet());
    }

    @Test
    @DisplayName("Gives up after the attempt ceiling and reports symbols failed")
    void testAttemptCeiling() {
        when(delegate.fetchQuotes(anySet()))
            .thenThrow(new ProviderException("coingecko", "timeout", true));

        var result = provider.fetchQuotes(Set.of("BTC", "ETH"));

        assertThat(result.quotes()).isEmpty();
        assertThat(result.failedSymbols()).containsExactlyInAnyOrder("BTC", "ETH");
        verify(delegate, times(3)).fetchQuotes(anySet());
        assertThat(registry.counter("market.provider.failure",
            "provider", "coingecko", "error", "ProviderException").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Non-retryable failures are not retried")
    void testNonRetryable() {
        when(delegate.fetchQuotes(anySet()))
            .thenThrow(new ProviderException("coingecko", "HTTP 404", false));

        var result = provider.fetchQuotes(Set.of("BTC"));

        assertThat(result.failedSymbols()).containsExactly("BTC");
        verify(delegate, times(1)).fetchQuotes(anySet());
    }

    @Test
    @DisplayName("Each retry needs a rate permit")
    void testRetryNeedsPermit() {
        var permitRequests = new AtomicInteger();
        var gated = new ResilientQuoteProvider(delegate, FAST, registry, clock, () -> {
            permitRequests.incrementAndGet();
            return false;
        });
        when(delegate.fetchQuotes(anySet()))
            .thenThrow(new ProviderException("coingecko", "HTTP 503", true));

        var result = gated.fetchQuotes(Set.of("BTC"));

        assertThat(result.failedSymbols()).containsExactly("BTC");
        verify(delegate, times(1)).fetchQuotes(anySet());
        assertThat(permitRequests.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Cached quotes are offered without an upstream call")
    void testCachedQuotes() {
        when(delegate.fetchQuotes(anySet())).thenReturn(btcResult(50000.0));

        assertThat(provider.cachedQuotes(Set.of("BTC"), false)).isEmpty();
        provider.fetchQuotes(Set.of("BTC"));

        assertThat(provider.cachedQuotes(Set.of("btc", "ETH"), false)).containsOnlyKeys("BTC");
        assertThat(provider.cachedQuotes(Set.of("BTC"), true)).isEmpty();
        clock.advance(Duration.ofSeconds(31));
        assertThat(provider.cachedQuotes(Set.of("BTC"), false)).isEmpty();
        verify(delegate, times(1)).fetchQuotes(anySet());
    }

    @Test
    @DisplayName("Adapter cache absorbs repeated calls until it expires")
    void testAdapterCache() {
        when(delegate.fetchQuotes(anySet())).thenReturn(btcResult(50000.0), btcResult(51000.0));

        provider.fetchQuotes(Set.of("BTC"));
        var cached = provider.fetchQuotes(Set.of("BTC"));
        assertThat(cached.quotes().get("BTC").price()).isEqualTo(50000.0);
        verify(delegate, times(1)).fetchQuotes(anySet());

        clock.advance(Duration.ofSeconds(31));
        var refreshed = provider.fetchQuotes(Set.of("BTC"));
        assertThat(refreshed.quotes().get("BTC").price()).isEqualTo(51000.0);
        verify(delegate, times(2)).fetchQuotes(anySet());
    }

    @Test
    @DisplayName("Forced refresh bypasses the adapter cache")
    void testForceRefreshBypassesCache() {
        when(delegate.fetchQuotes(anySet())).thenReturn(btcResult(50000.0), btcResult(52000.0));

        provider.fetchQuotes(Set.of("BTC"), false);
        var forced = provider.fetchQuotes(Set.of("BTC"), true);

        assertThat(forced.quotes().get("BTC").price()).isEqualTo(52000.0);
        verify(delegate, times(2)).fetchQuotes(anySet());
    }

    @Test
    @DisplayName("Circuit opens after repeated failures and short-circuits calls")
    void testCircuitBreakerOpens() {
        when(delegate.fetchQuotes(anySet()))
            .thenThrow(new ProviderException("coingecko", "HTTP 404", false));

        for (int i = 0; i < 5; i++) {
            provider.fetchQuotes(Set.of("BTC"), true);
        }
        assertThat(provider.getCircuitBreakerState()).isEqualTo("OPEN");

        var result = provider.fetchQuotes(Set.of("BTC"), true);
        assertThat(result.failedSymbols()).containsExactly("BTC");
        verify(delegate, times(5)).fetchQuotes(anySet());

        provider.resetCircuitBreaker();
        assertThat(provider.getCircuitBreakerState()).isEqualTo("CLOSED");
    }
}
