package com.simtrade.api.controller;

import com.simtrade.core.api.RateGovernor;
import com.simtrade.core.market.PriceResolver;
import com.simtrade.core.model.InstrumentCatalog;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Market data endpoints: quotes, instrument list and resolver statistics.
 */
public final class MarketDataController {
    private static final Logger logger = LoggerFactory.getLogger(MarketDataController.class);

    private final PriceResolver resolver;
    private final RateGovernor governor;
    private final InstrumentCatalog catalog;

    public MarketDataController(PriceResolver resolver, RateGovernor governor, InstrumentCatalog catalog) {
        this.resolver = resolver;
        this.governor = governor;
        this.catalog = catalog;
    }

    public void registerRoutes(Javalin app) {
        app.get("/api/quotes", this::getQuotes);
        app.get("/api/instruments", this::getInstruments);
        app.get("/api/market/stats", this::getMarketStats);
        app.post("/api/market/cache/clear", this::clearCache);
    }

    /**
     * GET /api/quotes?symbols=AAPL,BTC&forceRefresh=true
     */
    private void getQuotes(Context ctx) {
        String param = Optional.ofNullable(ctx.queryParam("symbols")).orElse("");
        List<String> symbols = Arrays.stream(param.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        if (symbols.isEmpty()) {
            ctx.status(400).json(Map.of(
                "error", "Missing symbols",
                "message", "Pass one or more symbols, e.g. ?symbols=AAPL,BTC"
            ));
            return;
        }
        boolean forceRefresh = Boolean.parseBoolean(ctx.queryParam("forceRefresh"));

        try {
            ctx.json(resolver.getQuotes(symbols, forceRefresh));
        } catch (Exception e) {
            logger.error("Failed to resolve quotes for {}", symbols, e);
            ctx.status(500).json(Map.of(
                "error", "Failed to resolve quotes",
                "message", String.valueOf(e.getMessage())
            ));
        }
    }

    private void getInstruments(Context ctx) {
        ctx.json(catalog.all());
    }

    private void getMarketStats(Context ctx) {
        var windows = resolver.getProviders().stream()
            .map(provider -> governor.snapshot(provider.id()))
            .flatMap(Optional::stream)
            .toList();
        ctx.json(Map.of(
            "resolver", resolver.getStats(),
            "rateWindows", windows
        ));
    }

    private void clearCache(Context ctx) {
        resolver.clearCache();
        logger.info("🗑️ Quote caches cleared via API");
        ctx.json(Map.of("cleared", true));
    }
}
