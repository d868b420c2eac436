package com.simtrade.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrade.core.MutableClock;
import com.simtrade.core.model.QuoteSource;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CoinGecko Provider Tests")
class CoinGeckoQuoteProviderTest {

    private static final String PRICES = """
        {
          "bitcoin": {"usd": 50000.0, "usd_24h_change": 2.0, "usd_24h_vol": 123456789.0, "usd_market_cap": 1.0E12},
          "ethereum": {"usd": 3000.0, "usd_24h_change": -1.0, "usd_24h_vol": 5000000.0}
        }
        """;

    private Javalin server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> body = new AtomicReference<>(PRICES);
    private final AtomicReference<String> lastIds = new AtomicReference<>();
    private CoinGeckoQuoteProvider provider;

    @BeforeEach
    void setUp() {
        server = Javalin.create(config -> config.showJavalinBanner = false)
            .get("/api/v3/simple/price", ctx -> {
                lastIds.set(ctx.queryParam("ids"));
                ctx.status(status.get()).contentType("application/json").result(body.get());
            })
            .start(0);

        provider = new CoinGeckoQuoteProvider(HttpClient.newHttpClient(), new ObjectMapper(),
            "http://localhost:" + server.port() + "/api/v3", Duration.ofSeconds(5), new MutableClock(5_000L));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should price a batch in one request and derive OHLC from the 24h change")
    void testFetchBatch() {
        var result = provider.fetchQuotes(Set.of("BTC", "ETH"));

        assertThat(result.failedSymbols()).isEmpty();
        assertThat(lastIds.get()).contains("bitcoin").contains("ethereum");

        var btc = result.quotes().get("BTC");
        assertThat(btc.price()).isEqualTo(50000.0);
        assertThat(btc.change()).isCloseTo(1000.0, within(0.001));
        assertThat(btc.open()).isCloseTo(49000.0, within(0.001));
        assertThat(btc.high()).isCloseTo(51000.0, within(0.001));
        assertThat(btc.low()).isCloseTo(48020.0, within(0.001));
        assertThat(btc.volume()).isEqualTo(123456789.0);
        assertThat(btc.source()).isEqualTo(QuoteSource.COINGECKO);
        assertThat(btc.realTime()).isTrue();
        assertThat(btc.timestamp()).isEqualTo(5_000L);
    }

    @Test
    @DisplayName("Unknown symbols and missing coins are failures, never invented")
    void testUnsupportedAndMissing() {
        var result = provider.fetchQuotes(Set.of("BTC", "SOL", "AAPL"));

        assertThat(result.quotes()).containsOnlyKeys("BTC");
        assertThat(result.failedSymbols()).containsExactlyInAnyOrder("SOL", "AAPL");
        assertThat(provider.isSupported("sol")).isTrue();
        assertThat(provider.isSupported("AAPL")).isFalse();
    }

    @Test
    @DisplayName("HTTP 429 is a retryable provider failure")
    void testRateLimitedIsRetryable() {
        status.set(429);

        assertThatThrownBy(() -> provider.fetchQuotes(Set.of("BTC")))
            .isInstanceOf(ProviderException.class)
            .satisfies(e -> assertThat(((ProviderException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("Malformed body is a retryable provider failure")
    void testMalformedBody() {
        body.set("<html>oops</html>");

        assertThatThrownBy(() -> provider.fetchQuotes(Set.of("ETH")))
            .isInstanceOf(ProviderException.class)
            .satisfies(e -> assertThat(((ProviderException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("HTTP 404 is not retried")
    void testClientErrorNotRetryable() {
        status.set(404);

        assertThatThrownBy(() -> provider.fetchQuotes(Set.of("ETH")))
            .isInstanceOf(ProviderException.class)
            .satisfies(e -> assertThat(((ProviderException) e).isRetryable()).isFalse());
    }
}
