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
 * CoinGecko simple-price adapter for cryptocurrencies.
 *
 * One request prices the whole batch. CoinGecko does not return OHLC data on
 * this endpoint, so open/high/low are derived from the 24h change.
 *
 * API Documentation: https://docs.coingecko.com/reference/simple-price
 */
public final class CoinGeckoQuoteProvider implements QuoteProvider {
    private static final Logger logger = LoggerFactory.getLogger(CoinGeckoQuoteProvider.class);

    public static final String ID = "coingecko";
    public static final String DEFAULT_BASE_URL = "https://api.coingecko.com/api/v3";

    private static final Map<String, String> SYMBOL_TO_ID = Map.ofEntries(
        Map.entry("BTC", "bitcoin"),
        Map.entry("ETH", "ethereum"),
        Map.entry("USDT", "tether"),
        Map.entry("BNB", "binancecoin"),
        Map.entry("SOL", "solana"),
        Map.entry("XRP", "ripple"),
        Map.entry("ADA", "cardano"),
        Map.entry("AVAX", "avalanche-2"),
        Map.entry("DOT", "polkadot"),
        Map.entry("MATIC", "matic-network"),
        Map.entry("LINK", "chainlink"),
        Map.entry("UNI", "uniswap"),
        Map.entry("LTC", "litecoin"),
        Map.entry("ICP", "internet-computer"),
        Map.entry("ATOM", "cosmos"),
        Map.entry("XLM", "stellar"),
        Map.entry("TRX", "tron"),
        Map.entry("NEAR", "near"),
        Map.entry("ALGO", "algorand"),
        Map.entry("VET", "vechain"),
        Map.entry("AAVE", "aave"),
        Map.entry("MKR", "maker"),
        Map.entry("SNX", "synthetix-network-token"),
        Map.entry("CRV", "curve-dao-token"),
        Map.entry("COMP", "compound-governance-token"),
        Map.entry("DOGE", "dogecoin"),
        Map.entry("SHIB", "shiba-inu"),
        Map.entry("USDC", "usd-coin"),
        Map.entry("DAI", "dai"),
        Map.entry("BUSD", "binance-usd")
    );

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final Clock clock;

    public CoinGeckoQuoteProvider(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                                  Duration requestTimeout, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        logger.info("🦎 CoinGecko provider initialized ({} coins, base={})", SYMBOL_TO_ID.size(), this.baseUrl);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isSupported(String symbol) {
        return SYMBOL_TO_ID.containsKey(Symbols.normalize(symbol));
    }

    @Override
    public ProviderResult fetchQuotes(Set<String> symbols) {
        var failed = new HashSet<String>();
        var idToSymbol = new LinkedHashMap<String, String>();
        for (String raw : symbols) {
            String symbol = Symbols.normalize(raw);
            String coinId = SYMBOL_TO_ID.get(symbol);
            if (coinId == null) {
                failed.add(symbol);
            } else {
                idToSymbol.put(coinId, symbol);
            }
        }
        if (idToSymbol.isEmpty()) {
            return new ProviderResult(Map.of(), failed);
        }

        JsonNode root = requestPrices(String.join(",", idToSymbol.keySet()));
        long now = clock.millis();
        var quotes = new HashMap<String, Quote>();

        idToSymbol.forEach((coinId, symbol) -> {
            JsonNode coin = root.get(coinId);
            double price = coin == null ? 0.0 : coin.path("usd").asDouble(0.0);
            if (!(price > 0)) {
                logger.debug("CoinGecko returned no usable price for {} ({})", symbol, coinId);
                failed.add(symbol);
                return;
            }
            quotes.put(symbol, toQuote(symbol, coin, price, now));
        });

        return new ProviderResult(quotes, failed);
    }

    private Quote toQuote(String symbol, JsonNode coin, double price, long now) {
        double changePercent = coin.path("usd_24h_change").asDouble(0.0);
        double change = price * changePercent / 100.0;
        double previous = price - change;
        double high = Math.max(price, previous) * 1.02;
        double low = Math.min(price, previous) * 0.98;
        double volume = coin.path("usd_24h_vol").asDouble(0.0);
        return new Quote(symbol, price, previous, high, low, previous, volume, change, changePercent,
            now, QuoteSource.COINGECKO, true);
    }

    private JsonNode requestPrices(String ids) {
        String url = baseUrl + "/simple/price?ids=" + ids
            + "&vs_currencies=usd&include_24hr_change=true&include_market_cap=true&include_24hr_vol=true";

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
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

        try {
            JsonNode root = objectMapper.readTree(response.body());
            if (root == null || !root.isObject()) {
                throw new ProviderException(ID, "unexpected response body", true);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ProviderException(ID, "malformed response body", true, e);
        }
    }
}
