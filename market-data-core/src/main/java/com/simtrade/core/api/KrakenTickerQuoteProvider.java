package com.simtrade.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrade.core.model.Quote;
import com.simtrade.core.model.QuoteSource;
import com.simtrade.core.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Kraken public Ticker adapter, used as the second crypto source.
 *
 * Kraken answers with its own canonical pair names (XBTUSD comes back as
 * XXBTZUSD), so result keys are matched back to the requested pair.
 */
public final class KrakenTickerQuoteProvider implements QuoteProvider {
    private static final Logger logger = LoggerFactory.getLogger(KrakenTickerQuoteProvider.class);

    public static final String ID = "kraken";
    public static final String DEFAULT_BASE_URL = "https://api.kraken.com";

    private static final Map<String, String> SYMBOL_TO_PAIR = Map.ofEntries(
        Map.entry("BTC", "XBTUSD"),
        Map.entry("ETH", "ETHUSD"),
        Map.entry("SOL", "SOLUSD"),
        Map.entry("ADA", "ADAUSD"),
        Map.entry("DOT", "DOTUSD"),
        Map.entry("XRP", "XRPUSD"),
        Map.entry("LTC", "LTCUSD"),
        Map.entry("LINK", "LINKUSD"),
        Map.entry("UNI", "UNIUSD"),
        Map.entry("AVAX", "AVAXUSD"),
        Map.entry("DOGE", "XDGUSD"),
        Map.entry("MATIC", "MATICUSD"),
        Map.entry("ATOM", "ATOMUSD"),
        Map.entry("ALGO", "ALGOUSD"),
        Map.entry("ICP", "ICPUSD")
    );

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final Clock clock;

    public KrakenTickerQuoteProvider(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                                     Duration requestTimeout, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        logger.info("🦑 Kraken ticker provider initialized ({} pairs)", SYMBOL_TO_PAIR.size());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isSupported(String symbol) {
        return SYMBOL_TO_PAIR.containsKey(Symbols.normalize(symbol));
    }

    @Override
    public ProviderResult fetchQuotes(Set<String> symbols) {
        var failed = new HashSet<String>();
        var pairToSymbol = new LinkedHashMap<String, String>();
        for (String raw : symbols) {
            String symbol = Symbols.normalize(raw);
            String pair = SYMBOL_TO_PAIR.get(symbol);
            if (pair == null) {
                failed.add(symbol);
            } else {
                pairToSymbol.put(pair, symbol);
            }
        }
        if (pairToSymbol.isEmpty()) {
            return new ProviderResult(Map.of(), failed);
        }

        JsonNode result = requestTicker(String.join(",", pairToSymbol.keySet()));
        long now = clock.millis();
        var quotes = new HashMap<String, Quote>();

        var fields = result.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            String symbol = symbolForResultKey(entry.getKey(), pairToSymbol);
            if (symbol == null) {
                continue;
            }
            try {
                quotes.put(symbol, toQuote(symbol, entry.getValue(), now));
            } catch (IllegalArgumentException e) {
                logger.debug("Kraken ticker for {} unusable: {}", symbol, e.getMessage());
            }
        }

        for (String symbol : pairToSymbol.values()) {
            if (!quotes.containsKey(symbol)) {
                failed.add(symbol);
            }
        }
        return new ProviderResult(quotes, failed);
    }

    /**
     * Kraken prefixes legacy assets: XBTUSD comes back as XXBTZUSD, ETHUSD as XETHZUSD.
     */
    static String symbolForResultKey(String resultKey, Map<String, String> pairToSymbol) {
        for (var entry : pairToSymbol.entrySet()) {
            String pair = entry.getKey();
            String base = pair.substring(0, pair.length() - 3);
            if (resultKey.equals(pair) || resultKey.equals("X" + base + "ZUSD")) {
                return entry.getValue();
            }
        }
        return null;
    }

    private Quote toQuote(String symbol, JsonNode ticker, long now) {
        double price = ticker.path("c").path(0).asDouble(0.0);
        double open = ticker.path("o").asDouble(price);
        double high = ticker.path("h").path(1).asDouble(price);
        double low = ticker.path("l").path(1).asDouble(price);
        double volume = ticker.path("v").path(1).asDouble(0.0);
        double change = price - open;
        double changePercent = open > 0 ? change / open * 100.0 : 0.0;
        return new Quote(symbol, price, open, high, low, price, volume, change, changePercent,
            now, QuoteSource.KRAKEN, true);
    }

    private JsonNode requestTicker(String pairs) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/0/public/Ticker?pair=" + pairs))
            .timeout(requestTimeout)
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(ID, "request timed out", true, e);
        } catch (IOException e) {
            throw new ProviderException(ID, "network error: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ID, "interrupted", false, e);
        }

        if (response.statusCode() != 200) {
            throw ProviderException.forStatus(ID, response.statusCode());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ProviderException(ID, "malformed response body", true, e);
        }

        JsonNode errors = root.path("error");
        if (errors.isArray() && !errors.isEmpty()) {
            String error = errors.get(0).asText();
            // EAPI:Rate limit exceeded, EService:Unavailable and EService:Busy clear up on their own
            boolean retryable = error.startsWith("EAPI:Rate limit") || error.startsWith("EService:");
            throw new ProviderException(ID, error, retryable);
        }

        JsonNode result = root.path("result");
        if (!result.isObject()) {
            throw new ProviderException(ID, "response has no result object", true);
        }
        return result;
    }
}
