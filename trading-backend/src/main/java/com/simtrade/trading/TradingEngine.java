package com.simtrade.trading;

import com.simtrade.balance.CashBalanceService;
import com.simtrade.balance.CashDeltaMetadata;
import com.simtrade.core.market.QuoteService;
import com.simtrade.core.model.Quote;
import com.simtrade.core.model.Symbols;
import com.simtrade.metrics.MetricsService;
import com.simtrade.metrics.PortfolioAnalytics;
import com.simtrade.persistence.TransactionJournal;
import com.simtrade.portfolio.Holding;
import com.simtrade.portfolio.Portfolio;
import com.simtrade.portfolio.PortfolioLedger;
import com.simtrade.sync.SyncDispatcher;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes buy and sell orders against the portfolio ledger and cash balance.
 *
 * One trade at a time: a call made while another trade is in flight is refused
 * with {@link TradeErrorCode#TRANSACTION_IN_PROGRESS}, it is not queued.
 *
 * Stages: VALIDATING, PRICING, MUTATING, SYNCING, then COMPLETED or FAILED.
 * Expected failures come back as typed {@link TradeResult}s and never as exceptions.
 * Remote sync is fire-and-forget; its failures never roll back local state.
 */
public final class TradingEngine {
    private static final Logger logger = LoggerFactory.getLogger(TradingEngine.class);

    private final QuoteService quoteService;
    private final PortfolioLedger ledger;
    private final TransactionLog transactions;
    private final CashBalanceService cashBalance;
    private final SyncDispatcher syncDispatcher;
    private final TransactionJournal journal;
    private final TradeLimits limits;
    private final MetricsService metrics;
    private final Executor executor;
    private final Clock clock;
    private final TransactionIds ids;
    private final Validator validator;
    private final Instant sessionStart;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicReference<TradeStage> stage = new AtomicReference<>(TradeStage.IDLE);

    public TradingEngine(QuoteService quoteService, PortfolioLedger ledger, TransactionLog transactions,
                         CashBalanceService cashBalance, SyncDispatcher syncDispatcher, TransactionJournal journal,
                         TradeLimits limits, MetricsService metrics, Executor executor, Clock clock) {
        this.quoteService = quoteService;
        this.ledger = ledger;
        this.transactions = transactions;
        this.cashBalance = cashBalance;
        this.syncDispatcher = syncDispatcher;
        this.journal = journal;
        this.limits = limits;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        this.ids = new TransactionIds(clock);
        this.validator = Validation.buildDefaultValidatorFactory().getValidator();
        this.sessionStart = clock.instant();
    }

    public CompletableFuture<TradeResult> buy(String symbol, double quantity) {
        return submit(TransactionType.BUY, symbol, quantity);
    }

    public CompletableFuture<TradeResult> sell(String symbol, double quantity) {
        return submit(TransactionType.SELL, symbol, quantity);
    }

    private CompletableFuture<TradeResult> submit(TransactionType type, String symbol, double quantity) {
        if (!inFlight.compareAndSet(false, true)) {
            metrics.recordTradeRejected(type.name(), TradeErrorCode.TRANSACTION_IN_PROGRESS.name());
            return CompletableFuture.completedFuture(TradeResult.failure(
                TradeErrorCode.TRANSACTION_IN_PROGRESS, "Another transaction is in progress"));
        }
        try {
            return CompletableFuture
                .supplyAsync(() -> execute(type, symbol, quantity), executor)
                .whenComplete((result, error) -> inFlight.set(false));
        } catch (RejectedExecutionException e) {
            inFlight.set(false);
            logger.error("Trade executor rejected {} {}", type, symbol, e);
            return CompletableFuture.completedFuture(TradeResult.failure(
                TradeErrorCode.TRANSACTION_FAILED, "Trading engine is shutting down"));
        }
    }

    private TradeResult execute(TransactionType type, String rawSymbol, double quantity) {
        long started = System.nanoTime();
        TradeResult result;
        try {
            result = runStages(type, Symbols.normalize(rawSymbol), quantity);
        } catch (RuntimeException e) {
            logger.error("❌ Unexpected failure before {} {} was recorded", type, rawSymbol, e);
            result = TradeResult.failure(TradeErrorCode.TRANSACTION_FAILED, "Transaction failed: " + e.getMessage());
        }

        stage.set(result.success() ? TradeStage.COMPLETED : TradeStage.FAILED);
        metrics.recordTradeLatency(type.name(), Duration.ofNanos(System.nanoTime() - started));
        if (!result.success()) {
            metrics.recordTradeRejected(type.name(), result.errorCode().name());
            logger.info("Trade rejected: {} {} x{} -> {} ({})", type, rawSymbol, quantity,
                result.errorCode(), result.error().message());
        }
        return result;
    }

    private TradeResult runStages(TransactionType type, String symbol, double quantity) {
        // Validate
        stage.set(TradeStage.VALIDATING);
        Set<ConstraintViolation<TradeRequest>> violations = validator.validate(new TradeRequest(symbol, quantity, type));
        if (!violations.isEmpty()) {
            return validationFailure(violations);
        }
        Optional<String> quantityProblem = limits.quantityViolation(quantity);
        if (quantityProblem.isPresent()) {
            return TradeResult.failure(TradeErrorCode.INVALID_QUANTITY, quantityProblem.get());
        }
        int shares = (int) quantity;

        Optional<Holding> held = ledger.getHolding(symbol);
        if (type == TransactionType.SELL) {
            int owned = held.map(Holding::quantity).orElse(0);
            if (owned < shares) {
                return TradeResult.failure(TradeErrorCode.INSUFFICIENT_SHARES,
                    String.format("Insufficient shares. You own %d shares of %s", owned, symbol));
            }
        }

        // Price
        stage.set(TradeStage.PRICING);
        Optional<Quote> quote = quoteService.getQuotes(List.of(symbol), false).get(symbol);
        if (quote.isEmpty()) {
            return TradeResult.failure(TradeErrorCode.PRICE_UNAVAILABLE, "Unable to fetch current price for " + symbol);
        }
        double price = quote.get().price();

        double amount = price * shares;
        Optional<String> amountProblem = limits.amountViolation(amount);
        if (amountProblem.isPresent()) {
            return TradeResult.failure(TradeErrorCode.VALIDATION_FAILED, amountProblem.get());
        }
        double fee = limits.fee(amount);

        var warnings = new ArrayList<String>();
        if (limits.isLargeTrade(amount)) {
            warnings.add("Large transaction - please confirm");
        }

        double cash = cashBalance.getBalance().cash();
        if (type == TransactionType.BUY && cash < amount + fee) {
            return TradeResult.failure(TradeErrorCode.INSUFFICIENT_FUNDS, String.format(
                "Insufficient funds. Need %.2f, have %.2f", amount + fee, cash));
        }

        // Mutate
        stage.set(TradeStage.MUTATING);
        Double realized = type == TransactionType.SELL
            ? (price - held.orElseThrow().averagePrice()) * shares - fee
            : null;
        double delta = type == TransactionType.BUY ? -(amount + fee) : amount - fee;
        var pending = new Transaction(ids.next(), symbol, type, shares, price, amount, fee, clock.instant(),
            TransactionStatus.PENDING, cash, cash + delta, realized, null);
        transactions.append(pending);

        Optional<Holding> holdingAfter;
        try {
            holdingAfter = type == TransactionType.BUY
                ? Optional.of(ledger.applyBuy(symbol, shares, price))
                : ledger.applySell(symbol, shares, price);
        } catch (RuntimeException e) {
            var failed = transactions.transition(pending.id(), TransactionStatus.FAILED, e.getMessage());
            logger.error("❌ Ledger update failed for {}", pending.id(), e);
            return TradeResult.failure(TradeErrorCode.TRANSACTION_FAILED, "Transaction failed: " + e.getMessage(), failed);
        }

        // Sync
        stage.set(TradeStage.SYNCING);
        try {
            cashBalance.applyDelta(pending.netCashDelta(), new CashDeltaMetadata(pending.id(),
                String.format("%s %d %s @ %.2f", type, shares, symbol, price), type));
        } catch (RuntimeException e) {
            logger.warn("⚠️ Cash update failed for {}: {}", pending.id(), e.getMessage());
            warnings.add("Cash balance update failed: " + e.getMessage());
        }

        var completed = transactions.transition(pending.id(), TransactionStatus.COMPLETED, null);

        try {
            journal.recordTrade(completed, holdingAfter);
        } catch (RuntimeException e) {
            logger.warn("⚠️ Journal write failed for {}: {}", completed.id(), e.getMessage());
            warnings.add("Transaction not saved locally: " + e.getMessage());
        }

        if (!syncDispatcher.dispatch(completed)) {
            warnings.add("Remote sync queue full; transaction kept locally");
        }

        metrics.recordTradeExecuted(type.name(), symbol, amount);
        if (!warnings.isEmpty()) {
            metrics.recordTradeWarning(type.name());
        }
        logger.atInfo()
            .addKeyValue("id", completed.id())
            .addKeyValue("type", type)
            .addKeyValue("symbol", symbol)
            .addKeyValue("quantity", shares)
            .addKeyValue("price", price)
            .addKeyValue("fee", fee)
            .log("✅ Trade completed");

        return TradeResult.success(completed, warnings);
    }

    private static TradeResult validationFailure(Set<ConstraintViolation<TradeRequest>> violations) {
        boolean symbolProblem = violations.stream()
            .anyMatch(v -> v.getPropertyPath().toString().equals("symbol"));
        String message = violations.stream()
            .map(ConstraintViolation::getMessage)
            .sorted()
            .reduce((a, b) -> a + "; " + b)
            .orElse("Invalid request");
        return TradeResult.failure(symbolProblem ? TradeErrorCode.INVALID_SYMBOL : TradeErrorCode.INVALID_QUANTITY, message);
    }

    /**
     * Value holdings at current prices. Holdings without a price are valued at cost.
     */
    public Portfolio getPortfolioSnapshot() {
        var symbols = ledger.symbols();
        var prices = new HashMap<String, Double>();
        if (!symbols.isEmpty()) {
            quoteService.getQuotes(symbols, false).quotes()
                .forEach((symbol, quote) -> prices.put(symbol, quote.price()));
        }
        return ledger.snapshot(prices);
    }

    public Optional<Holding> getHolding(String symbol) {
        return ledger.getHolding(symbol);
    }

    /**
     * Most recent first.
     */
    public List<Transaction> getTransactions(int limit) {
        return transactions.recent(limit);
    }

    public TradeStatistics getStats() {
        return TradeStatistics.from(getPortfolioSnapshot(), transactions.all(), isProcessing());
    }

    /**
     * Win/loss, drawdown and per-holding performance over the full history.
     */
    public PortfolioAnalytics.PerformanceReport getAnalytics() {
        return PortfolioAnalytics.analyze(getPortfolioSnapshot(), transactions.all(),
            cashBalance.getBalance().cash(), sessionStart, clock.instant());
    }

    public TradeStage currentStage() {
        return stage.get();
    }

    public boolean isProcessing() {
        return inFlight.get();
    }

    public TradeLimits limits() {
        return limits;
    }
}
