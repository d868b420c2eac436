package com.simtrade.core.market;

import com.simtrade.core.MutableClock;
import com.simtrade.core.api.ProviderResult;
import com.simtrade.core.api.QuoteProvider;
import com.simtrade.core.api.RateGovernor;
import com.simtrade.core.cache.MemoryQuoteCache;
import com.simtrade.core.cache.TieredQuoteCache;
import com.simtrade.core.model.Quote;
import com.simtrade.core.model.QuoteSource;
import com.simtrade.core.persistence.QuoteStoreDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PriceResolver Tests")
class PriceResolverTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private TieredQuoteCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        cache = new TieredQuoteCache(List.of(
            new MemoryQuoteCache(Duration.ofMinutes(5)),
            new QuoteStoreDatabase(tempDir.resolve("quotes.db").toString(), Duration.ofMinutes(60))
        ), clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private RateGovernor generousGovernor() {
        return new RateGovernor(new RateGovernor.Limits(100, Duration.ZERO), Map.of(), clock);
    }

    private PriceResolver resolver(RateGovernor governor, QuoteProvider... providers) {
        return new PriceResolver(cache, governor, List.of(providers),
            PriceResolver.DEFAULT_MAX_SYMBOLS_PER_BATCH, new SimpleMeterRegistry(), Runnable::run);
    }

    @Test
    @DisplayName("Second request inside the cache lifetime makes no provider call")
    void testCacheHitAvoidsProvider() {
        var provider = new StubProvider("coingecko", symbol -> true, Map.of("BTC", 50000.0));
        var resolver = resolver(generousGovernor(), provider);

        var first = resolver.getQuotes(List.of("BTC"));
        clock.advance(Duration.ofMinutes(1));
        var second = resolver.getQuotes(List.of("btc"));

        assertThat(provider.calls).hasSize(1);
        assertThat(first.get("BTC")).get().extracting(Quote::realTime).isEqualTo(true);
        assertThat(second.get("BTC")).get().extracting(Quote::source).isEqualTo(QuoteSource.MEMORY);
        assertThat(resolver.getStats().cacheHits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Forced refresh skips the cache")
    void testForceRefresh() {
        var provider = new StubProvider("coingecko", symbol -> true, Map.of("BTC", 50000.0));
        var resolver = resolver(generousGovernor(), provider);

        resolver.getQuotes(List.of("BTC"));
        resolver.getQuotes(List.of("BTC"), true);

        assertThat(provider.calls).hasSize(2);
        assertThat(provider.forceFlags).containsExactly(false, true);
    }

    @Test
    @DisplayName("Symbols the first provider cannot price go to the next one")
    void testFallsThroughProviders() {
        var crypto = new StubProvider("coingecko", symbol -> symbol.equals("BTC"), Map.of("BTC", 50000.0));
        var equities = new StubProvider("alphavantage", symbol -> !symbol.equals("BTC"), Map.of("AAPL", 190.0));
        var resolver = resolver(generousGovernor(), crypto, equities);

        var batch = resolver.getQuotes(List.of("BTC", "AAPL"));

        assertThat(batch.quotes()).containsOnlyKeys("BTC", "AAPL");
        assertThat(batch.isComplete()).isTrue();
        assertThat(crypto.calls.get(0)).containsExactly("BTC");
        assertThat(equities.calls.get(0)).containsExactly("AAPL");
    }

    @Test
    @DisplayName("A provider's missing symbols are retried on the next provider")
    void testPartialResult() {
        var first = new StubProvider("coingecko", symbol -> true, Map.of("BTC", 50000.0));
        var second = new StubProvider("kraken", symbol -> true, Map.of("ETH", 3000.0));
        var resolver = resolver(generousGovernor(), first, second);

        var batch = resolver.getQuotes(List.of("BTC", "ETH"));

        assertThat(batch.quotes()).containsOnlyKeys("BTC", "ETH");
        assertThat(second.calls.get(0)).containsExactly("ETH");
    }

    @Test
    @DisplayName("Governor denial falls back to the stored quote")
    void testGovernorDenialUsesStore() {
        cache.put("AAPL", Quote.of("AAPL", 180.0, QuoteSource.ALPHA_VANTAGE, clock.millis()));
        clock.advance(Duration.ofMinutes(10));

        var governor = new RateGovernor(new RateGovernor.Limits(0, Duration.ZERO), Map.of(), clock);
        var provider = new StubProvider("alphavantage", symbol -> true, Map.of("AAPL", 190.0));
        var resolver = resolver(governor, provider);

        var batch = resolver.getQuotes(List.of("AAPL"), true);

        assertThat(provider.calls).isEmpty();
        var quote = batch.get("AAPL").orElseThrow();
        assertThat(quote.price()).isEqualTo(180.0);
        assertThat(quote.source()).isEqualTo(QuoteSource.STORE);
        assertThat(resolver.getStats().governorDenials()).isEqualTo(1);
        assertThat(resolver.getStats().fallbackHits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Nothing anywhere leaves the symbol unresolved without a made-up price")
    void testUnresolved() {
        var provider = new StubProvider("coingecko", symbol -> true, Map.of());
        var resolver = resolver(generousGovernor(), provider);

        var batch = resolver.getQuotes(List.of("ZZZZ", " "));

        assertThat(batch.quotes()).isEmpty();
        assertThat(batch.unresolvedSymbols()).containsExactly("ZZZZ");
        assertThat(resolver.getStats().unresolved()).isEqualTo(1);
    }

    @Test
    @DisplayName("Empty request makes no calls")
    void testEmptyRequest() {
        var provider = new StubProvider("coingecko", symbol -> true, Map.of("BTC", 1.0));
        var batch = resolver(generousGovernor(), provider).getQuotes(List.of());

        assertThat(batch.quotes()).isEmpty();
        assertThat(batch.unresolvedSymbols()).isEmpty();
        assertThat(provider.calls).isEmpty();
    }

    @Test
    @DisplayName("Large requests are split into batches, one permit each")
    void testBatching() {
        var prices = IntStream.rangeClosed(1, 25).boxed()
            .collect(Collectors.toMap(i -> "S" + i, i -> (double) i));
        var provider = new StubProvider("coingecko", symbol -> true, prices);
        var governor = generousGovernor();
        var resolver = resolver(governor, provider);

        var batch = resolver.getQuotes(prices.keySet());

        assertThat(batch.quotes()).hasSize(25);
        assertThat(provider.calls).hasSize(2);
        assertThat(provider.calls.get(0)).hasSize(20);
        assertThat(provider.calls.get(1)).hasSize(5);
        assertThat(governor.snapshot("coingecko").orElseThrow().callsInWindow()).isEqualTo(2);
    }

    @Test
    @DisplayName("Delivered timestamps never go backwards for a symbol")
    void testMonotonicTimestamps() {
        var provider = new StubProvider("coingecko", symbol -> true, Map.of("BTC", 50000.0));
        var resolver = resolver(generousGovernor(), provider);

        long fresh = clock.millis();
        var first = resolver.getQuotes(List.of("BTC"), true).get("BTC").orElseThrow();
        assertThat(first.timestamp()).isEqualTo(fresh);

        // Upstream now answers with an older observation
        provider.timestampOffset = -60_000L;
        clock.advanceMillis(10);
        var second = resolver.getQuotes(List.of("BTC"), true).get("BTC").orElseThrow();

        assertThat(second.timestamp()).isGreaterThanOrEqualTo(first.timestamp());
    }

    @Test
    @DisplayName("A throwing provider does not break resolution")
    void testProviderThrows() {
        QuoteProvider broken = new StubProvider("coingecko", symbol -> true, Map.of()) {
            @Override
            public ProviderResult fetchQuotes(Set<String> symbols, boolean forceRefresh) {
                throw new IllegalStateException("boom");
            }
        };
        var backup = new StubProvider("kraken", symbol -> true, Map.of("BTC", 49000.0));
        var resolver = resolver(generousGovernor(), broken, backup);

        var batch = resolver.getQuotes(List.of("BTC"));

        assertThat(batch.get("BTC")).get().extracting(Quote::price).isEqualTo(49000.0);
        assertThat(resolver.getStats().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Clearing the cache forces the next request upstream")
    void testClearCache() {
        var provider = new StubProvider("coingecko", symbol -> true, Map.of("BTC", 50000.0));
        var resolver = resolver(generousGovernor(), provider);

        resolver.getQuotes(List.of("BTC"));
        resolver.clearCache();
        resolver.getQuotes(List.of("BTC"));

        assertThat(provider.calls).hasSize(2);
        assertThat(provider.cleared).isTrue();
    }

    @Test
    @DisplayName("Async lookup completes with the same batch")
    void testAsync() {
        var provider = new StubProvider("coingecko", symbol -> true, Map.of("ETH", 3000.0));
        var resolver = resolver(generousGovernor(), provider);

        var batch = resolver.getQuotesAsync(List.of("ETH"), false).join();

        assertThat(batch.get("ETH")).isPresent();
    }

    private class StubProvider implements QuoteProvider {
        private final String id;
        private final Predicate<String> supported;
        private final Map<String, Double> prices;
        final List<Set<String>> calls = Collections.synchronizedList(new ArrayList<>());
        final List<Boolean> forceFlags = Collections.synchronizedList(new ArrayList<>());
        volatile long timestampOffset;
        volatile boolean cleared;

        StubProvider(String id, Predicate<String> supported, Map<String, Double> prices) {
            this.id = id;
            this.supported = supported;
            this.prices = prices;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isSupported(String symbol) {
            return supported.test(symbol);
        }

        @Override
        public ProviderResult fetchQuotes(Set<String> symbols) {
            return fetchQuotes(symbols, false);
        }

        @Override
        public ProviderResult fetchQuotes(Set<String> symbols, boolean forceRefresh) {
            calls.add(Set.copyOf(symbols));
            forceFlags.add(forceRefresh);
            var quotes = new HashMap<String, Quote>();
            var failed = new HashSet<String>();
            for (String symbol : symbols) {
                Double price = prices.get(symbol);
                if (price == null) {
                    failed.add(symbol);
                } else {
                    quotes.put(symbol, Quote.of(symbol, price, QuoteSource.COINGECKO, clock.millis() + timestampOffset));
                }
            }
            return new ProviderResult(quotes, failed);
        }

        @Override
        public void clearCache() {
            cleared = true;
        }
    }
}
