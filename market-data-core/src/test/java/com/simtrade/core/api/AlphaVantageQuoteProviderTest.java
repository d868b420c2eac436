package com.simtrade.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrade.core.MutableClock;
import com.simtrade.core.model.InstrumentCatalog;
import com.simtrade.core.model.QuoteSource;
import io.javalin.Javalin;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Alpha Vantage Provider Tests")
class AlphaVantageQuoteProviderTest {

    private Javalin server;
    private AlphaVantageQuoteProvider provider;
    private final List<String> requested = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        server = Javalin.create(config -> config.showJavalinBanner = false)
            .get("/query", ctx -> {
                String symbol = ctx.queryParam("symbol");
                requested.add(symbol);
                ctx.contentType("application/json");
                switch (symbol == null ? "" : symbol) {
                    case "AAPL" -> ctx.result("""
                        {"Global Quote": {
                          "01. symbol": "AAPL", "02. open": "190.00", "03. high": "195.50",
                          "04. low": "189.25", "05. price": "194.10", "06. volume": "51234567",
                          "07. latest trading day": "2024-05-01", "08. previous close": "191.00",
                          "09. change": "3.10", "10. change percent": "1.6230%"}}
                        """);
                    case "BROKEN" -> ctx.status(503).result("{}");
                    case "LIMIT" -> ctx.result("{\"Note\": \"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute\"}");
                    default -> ctx.result("{\"Global Quote\": {}}");
                }
            })
            .start(0);

        provider = new AlphaVantageQuoteProvider(new OkHttpClient(), new ObjectMapper(),
            "http://localhost:" + server.port(), "test-key", InstrumentCatalog.defaultCatalog(), new MutableClock(7L));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should parse GLOBAL_QUOTE fields")
    void testParseGlobalQuote() {
        var result = provider.fetchQuotes(Set.of("AAPL"));

        var aapl = result.quotes().get("AAPL");
        assertThat(aapl).isNotNull();
        assertThat(aapl.price()).isEqualTo(194.10);
        assertThat(aapl.open()).isEqualTo(190.00);
        assertThat(aapl.close()).isEqualTo(191.00);
        assertThat(aapl.change()).isEqualTo(3.10);
        assertThat(aapl.changePercent()).isCloseTo(1.623, within(0.0001));
        assertThat(aapl.source()).isEqualTo(QuoteSource.ALPHA_VANTAGE);
    }

    @Test
    @DisplayName("Empty quote means the symbol is unknown")
    void testUnknownSymbol() {
        var result = provider.fetchQuotes(new LinkedHashSet<>(List.of("AAPL", "ZZZZ")));

        assertThat(result.quotes()).containsOnlyKeys("AAPL");
        assertThat(result.failedSymbols()).containsExactly("ZZZZ");
    }

    @Test
    @DisplayName("Quota notes are reported as non-retryable failures")
    void testQuotaNote() {
        assertThatThrownBy(() -> provider.fetchQuotes(Set.of("LIMIT")))
            .isInstanceOf(ProviderException.class)
            .satisfies(e -> assertThat(((ProviderException) e).isRetryable()).isFalse());
    }

    @Test
    @DisplayName("A quota note stops the batch but keeps quotes already priced")
    void testQuotaMidBatchKeepsEarlierQuotes() {
        var result = provider.fetchQuotes(new LinkedHashSet<>(List.of("AAPL", "LIMIT", "MSFT")));

        assertThat(result.quotes()).containsOnlyKeys("AAPL");
        assertThat(result.failedSymbols()).containsExactlyInAnyOrder("LIMIT", "MSFT");
        assertThat(requested).containsExactly("AAPL", "LIMIT");
    }

    @Test
    @DisplayName("A server error fails only its own symbol")
    void testServerErrorFailsOneSymbol() {
        var result = provider.fetchQuotes(new LinkedHashSet<>(List.of("BROKEN", "AAPL")));

        assertThat(result.quotes()).containsOnlyKeys("AAPL");
        assertThat(result.failedSymbols()).containsExactly("BROKEN");
    }

    @Test
    @DisplayName("A batch with nothing priced rethrows so it can be retried")
    void testWholeBatchFailureRethrows() {
        assertThatThrownBy(() -> provider.fetchQuotes(Set.of("BROKEN")))
            .isInstanceOf(ProviderException.class)
            .satisfies(e -> assertThat(((ProviderException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("One symbol per upstream request")
    void testOneSymbolPerRequest() {
        assertThat(provider.maxSymbolsPerRequest()).isEqualTo(1);
    }

    @Test
    @DisplayName("Crypto tickers are not routed to Alpha Vantage")
    void testSupport() {
        assertThat(provider.isSupported("AAPL")).isTrue();
        assertThat(provider.isSupported("BRK.B")).isTrue();
        assertThat(provider.isSupported("BTC")).isFalse();
        assertThat(provider.isSupported("not a symbol")).isFalse();
    }
}
