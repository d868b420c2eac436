package com.simtrade.api.controller;

import com.simtrade.balance.CashBalanceService;
import com.simtrade.trading.TradeErrorCode;
import com.simtrade.trading.TradeResult;
import com.simtrade.trading.TradingEngine;
import com.simtrade.trading.TransactionType;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Trading endpoints: buy, sell, portfolio, transactions, statistics and analytics.
 */
public final class TradingController {
    private static final Logger logger = LoggerFactory.getLogger(TradingController.class);

    static final int DEFAULT_TRANSACTION_LIMIT = 50;
    static final int MAX_TRANSACTION_LIMIT = 1000;

    private final TradingEngine engine;
    private final CashBalanceService cashBalance;

    public TradingController(TradingEngine engine, CashBalanceService cashBalance) {
        this.engine = engine;
        this.cashBalance = cashBalance;
    }

    public void registerRoutes(Javalin app) {
        app.post("/api/trades/buy", ctx -> trade(ctx, TransactionType.BUY));
        app.post("/api/trades/sell", ctx -> trade(ctx, TransactionType.SELL));
        app.get("/api/trades/stats", this::getStats);
        app.get("/api/analytics", this::getAnalytics);
        app.get("/api/portfolio", this::getPortfolio);
        app.get("/api/portfolio/{symbol}", this::getHolding);
        app.get("/api/transactions", this::getTransactions);
    }

    /**
     * Request body for buy and sell.
     */
    public record TradeBody(String symbol, Double quantity) {
    }

    private void trade(Context ctx, TransactionType type) {
        TradeBody body;
        try {
            body = ctx.bodyAsClass(TradeBody.class);
        } catch (Exception e) {
            logger.debug("Unreadable trade body: {}", e.getMessage());
            body = null;
        }
        if (body == null) {
            ctx.status(400).json(Map.of(
                "error", "Malformed request",
                "message", "Expected JSON body {\"symbol\": ..., \"quantity\": ...}"
            ));
            return;
        }

        double quantity = body.quantity() == null ? 0.0 : body.quantity();
        var future = type == TransactionType.BUY
            ? engine.buy(body.symbol(), quantity)
            : engine.sell(body.symbol(), quantity);

        ctx.future(() -> future.thenAccept(result -> ctx.status(statusFor(result)).json(result)));
    }

    static int statusFor(TradeResult result) {
        if (result.success()) {
            return 200;
        }
        TradeErrorCode code = result.errorCode();
        return switch (code) {
            case INVALID_SYMBOL, INVALID_QUANTITY, INSUFFICIENT_FUNDS,
                 INSUFFICIENT_SHARES, VALIDATION_FAILED -> 422;
            case TRANSACTION_IN_PROGRESS -> 409;
            case PRICE_UNAVAILABLE -> 503;
            case TRANSACTION_FAILED -> 500;
        };
    }

    private void getPortfolio(Context ctx) {
        try {
            ctx.json(Map.of(
                "portfolio", engine.getPortfolioSnapshot(),
                "balance", cashBalance.getBalance()
            ));
        } catch (Exception e) {
            logger.error("Failed to build portfolio snapshot", e);
            ctx.status(500).json(Map.of(
                "error", "Failed to build portfolio",
                "message", String.valueOf(e.getMessage())
            ));
        }
    }

    private void getHolding(Context ctx) {
        String symbol = ctx.pathParam("symbol");
        engine.getHolding(symbol).ifPresentOrElse(
            ctx::json,
            () -> ctx.status(404).json(Map.of("error", "No holding for " + symbol.toUpperCase())));
    }

    private void getTransactions(Context ctx) {
        int limit;
        try {
            limit = ctx.queryParamAsClass("limit", Integer.class).getOrDefault(DEFAULT_TRANSACTION_LIMIT);
        } catch (Exception e) {
            ctx.status(400).json(Map.of("error", "limit must be an integer"));
            return;
        }
        if (limit < 1 || limit > MAX_TRANSACTION_LIMIT) {
            ctx.status(400).json(Map.of("error", "limit must be between 1 and " + MAX_TRANSACTION_LIMIT));
            return;
        }
        ctx.json(engine.getTransactions(limit));
    }

    private void getStats(Context ctx) {
        ctx.json(engine.getStats());
    }

    private void getAnalytics(Context ctx) {
        ctx.json(engine.getAnalytics());
    }
}
