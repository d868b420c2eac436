package com.simtrade.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrade.core.model.InstrumentCatalog;
import com.simtrade.core.model.Quote;
import com.simtrade.core.model.QuoteSource;
import com.simtrade.core.model.Symbols;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Alpha Vantage GLOBAL_QUOTE adapter for equities.
 *
 * The endpoint prices one symbol per request. Alpha Vantage reports throttling
 * with a 200 response carrying a "Note" or "Information" field instead of a quote.
 *
 * API Documentation: https://www.alphavantage.co/documentation/#latestprice
 */
public final class AlphaVantageQuoteProvider implements QuoteProvider {
    private static final Logger logger = LoggerFactory.getLogger(AlphaVantageQuoteProvider.class);

    public static final String ID = "alphavantage";
    public static final String DEFAULT_BASE_URL = "https://www.alphavantage.co";

    private static final Pattern EQUITY_SYMBOL = Pattern.compile("^[A-Z][A-Z0-9.\\-]{0,9}$");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final InstrumentCatalog catalog;
    private final Clock clock;

    public AlphaVantageQuoteProvider(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                                     String apiKey, InstrumentCatalog catalog, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.apiKey = apiKey;
        this.catalog = catalog;
        this.clock = clock;

        if (apiKey == null || apiKey.isBlank()) {
            logger.warn("⚠️ Alpha Vantage API key not configured - equity quotes will use the demo key");
        } else {
            logger.info("🔑 Alpha Vantage provider initialized");
        }
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isSupported(String symbol) {
        String normalized = Symbols.normalize(symbol);
        return EQUITY_SYMBOL.matcher(normalized).matches() && !catalog.isCrypto(normalized);
    }

    @Override
    public int maxSymbolsPerRequest() {
        return 1;
    }

    /**
     * Prices symbols one request at a time. A failed request only fails its own
     * symbol; a quota or client error stops the loop but keeps what was priced.
     * When nothing could be priced the last error is rethrown so callers can retry.
     */
    @Override
    public ProviderResult fetchQuotes(Set<String> symbols) {
        var quotes = new HashMap<String, Quote>();
        var failed = new LinkedHashSet<String>();
        ProviderException lastError = null;

        var remaining = new ArrayList<String>();
        for (String raw : symbols) {
            remaining.add(Symbols.normalize(raw));
        }

        for (int i = 0; i < remaining.size(); i++) {
            String symbol = remaining.get(i);
            if (!isSupported(symbol)) {
                failed.add(symbol);
                continue;
            }

            JsonNode globalQuote;
            try {
                globalQuote = requestGlobalQuote(symbol);
            } catch (ProviderException e) {
                lastError = e;
                failed.add(symbol);
                if (!e.isRetryable()) {
                    logger.warn("Alpha Vantage stopped at {}: {}", symbol, e.getMessage());
                    failed.addAll(remaining.subList(i + 1, remaining.size()));
                    break;
                }
                logger.debug("Alpha Vantage request for {} failed: {}", symbol, e.getMessage());
                continue;
            }

            double price = parseNumber(globalQuote.path("05. price").asText(""));
            if (!(price > 0)) {
                logger.debug("Alpha Vantage has no quote for {}", symbol);
                failed.add(symbol);
                continue;
            }
            quotes.put(symbol, toQuote(symbol, globalQuote, price));
        }

        if (quotes.isEmpty() && lastError != null) {
            throw lastError;
        }
        return new ProviderResult(quotes, failed);
    }

    private Quote toQuote(String symbol, JsonNode globalQuote, double price) {
        double open = orDefault(parseNumber(globalQuote.path("02. open").asText("")), price);
        double high = orDefault(parseNumber(globalQuote.path("03. high").asText("")), price);
        double low = orDefault(parseNumber(globalQuote.path("04. low").asText("")), price);
        double volume = orDefault(parseNumber(globalQuote.path("06. volume").asText("")), 0.0);
        double previousClose = orDefault(parseNumber(globalQuote.path("08. previous close").asText("")), price);
        double change = orDefault(parseNumber(globalQuote.path("09. change").asText("")), price - previousClose);
        double changePercent = orDefault(
            parseNumber(globalQuote.path("10. change percent").asText("").replace("%", "")), 0.0);
        return new Quote(symbol, price, open, high, low, previousClose, volume, change, changePercent,
            clock.millis(), QuoteSource.ALPHA_VANTAGE, true);
    }

    private JsonNode requestGlobalQuote(String symbol) {
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegment("query")
            .addQueryParameter("function", "GLOBAL_QUOTE")
            .addQueryParameter("symbol", symbol)
            .addQueryParameter("apikey", apiKey == null || apiKey.isBlank() ? "demo" : apiKey)
            .build();

        Request request = new Request.Builder()
            .url(url)
            .get()
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw ProviderException.forStatus(ID, response.code());
            }
            String body = response.body() == null ? "" : response.body().string();
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ProviderException(ID, "unexpected response body", true);
            }
            if (root.has("Note") || root.has("Information")) {
                // Daily/minute quota messages; retrying within seconds does not help
                throw new ProviderException(ID, "quota exhausted: " + root.path("Note").asText(root.path("Information").asText()), false);
            }
            return root.path("Global Quote");
        } catch (JsonProcessingException e) {
            throw new ProviderException(ID, "malformed response body", true, e);
        } catch (InterruptedIOException e) {
            throw new ProviderException(ID, "request timed out", true, e);
        } catch (IOException e) {
            throw new ProviderException(ID, "network error: " + e.getMessage(), true, e);
        }
    }

    private static double parseNumber(String value) {
        if (value == null || value.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static double orDefault(double value, double fallback) {
        return Double.isNaN(value) ? fallback : value;
    }
}
