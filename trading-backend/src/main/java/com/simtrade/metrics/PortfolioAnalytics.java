package com.simtrade.metrics;

import com.simtrade.portfolio.HoldingValuation;
import com.simtrade.portfolio.Portfolio;
import com.simtrade.trading.Transaction;
import com.simtrade.trading.TransactionStatus;
import com.simtrade.trading.TransactionType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Performance analytics over the transaction history and the current portfolio.
 *
 * Provides:
 * - Win rate, average win/loss, profit factor and extremes over closed (sell) trades
 * - Max drawdown and volatility of an equity curve replayed from the history
 * - Per-holding performance with best and worst performer
 *
 * Only COMPLETED transactions count. The equity curve marks each holding at its
 * last trade price after every trade and ends with the portfolio at current prices.
 */
public final class PortfolioAnalytics {

    private PortfolioAnalytics() {
    }

    public static PerformanceReport analyze(Portfolio portfolio, List<Transaction> history, double cash,
                                            Instant sessionStart, Instant now) {
        var completed = history.stream()
            .filter(tx -> tx.status() == TransactionStatus.COMPLETED)
            .sorted(Comparator.comparing(Transaction::timestamp))
            .toList();

        int wins = 0;
        int losses = 0;
        int closed = 0;
        double grossProfit = 0;
        double grossLoss = 0;
        double largestWin = 0;
        double largestLoss = 0;
        double volume = 0;
        double realized = 0;
        int sessionTrades = 0;

        for (Transaction tx : completed) {
            volume += tx.totalAmount();
            if (!tx.timestamp().isBefore(sessionStart)) {
                sessionTrades++;
            }
            if (tx.type() != TransactionType.SELL || tx.realizedGainLoss() == null) {
                continue;
            }
            double pnl = tx.realizedGainLoss();
            closed++;
            realized += pnl;
            if (pnl > 0) {
                wins++;
                grossProfit += pnl;
                largestWin = Math.max(largestWin, pnl);
            } else if (pnl < 0) {
                losses++;
                grossLoss += -pnl;
                largestLoss = Math.min(largestLoss, pnl);
            }
        }

        List<Double> equity = equityCurve(completed, cash + portfolio.totalValue());
        double sessionHours = Math.max(0, Duration.between(sessionStart, now).toMillis()) / 3_600_000.0;

        List<SymbolPerformance> performance = symbolPerformance(portfolio, completed, now);
        SymbolPerformance best = performance.stream()
            .max(Comparator.comparingDouble(SymbolPerformance::unrealizedGainLossPercent))
            .orElse(null);
        SymbolPerformance worst = performance.stream()
            .min(Comparator.comparingDouble(SymbolPerformance::unrealizedGainLossPercent))
            .orElse(null);

        return new PerformanceReport(
            closed,
            wins,
            losses,
            closed > 0 ? (double) wins / closed * 100.0 : 0.0,
            wins > 0 ? grossProfit / wins : 0.0,
            losses > 0 ? grossLoss / losses : 0.0,
            grossLoss == 0 ? 0.0 : grossProfit / grossLoss,
            largestWin,
            largestLoss,
            volume,
            realized,
            portfolio.totalGainLoss(),
            maxDrawdownPercent(equity),
            volatilityPercent(equity),
            sessionStart,
            sessionHours,
            sessionHours > 0 ? sessionTrades / sessionHours : 0.0,
            best,
            worst,
            performance
        );
    }

    /**
     * Account equity after each trade, starting from the cash before the first one.
     */
    static List<Double> equityCurve(List<Transaction> completed, double currentEquity) {
        var curve = new ArrayList<Double>();
        if (completed.isEmpty()) {
            return curve;
        }
        curve.add(completed.get(0).balanceBefore());

        Map<String, Integer> quantities = new HashMap<>();
        Map<String, Double> marks = new HashMap<>();
        for (Transaction tx : completed) {
            int delta = tx.type() == TransactionType.BUY ? tx.quantity() : -tx.quantity();
            quantities.merge(tx.symbol(), delta, Integer::sum);
            marks.put(tx.symbol(), tx.price());

            double holdingsValue = 0;
            for (var entry : quantities.entrySet()) {
                holdingsValue += entry.getValue() * marks.get(entry.getKey());
            }
            curve.add(tx.balanceAfter() + holdingsValue);
        }
        curve.add(currentEquity);
        return curve;
    }

    static double maxDrawdownPercent(List<Double> equity) {
        if (equity.size() < 2) {
            return 0.0;
        }
        double peak = equity.get(0);
        double maxDrawdown = 0.0;
        for (double value : equity) {
            if (value > peak) {
                peak = value;
            } else if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak);
            }
        }
        return maxDrawdown * 100.0;
    }

    static double volatilityPercent(List<Double> equity) {
        var returns = new ArrayList<Double>();
        for (int i = 1; i < equity.size(); i++) {
            double previous = equity.get(i - 1);
            if (previous > 0) {
                returns.add((equity.get(i) - previous) / previous);
            }
        }
        if (returns.isEmpty()) {
            return 0.0;
        }
        var mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        var variance = returns.stream().mapToDouble(r -> Math.pow(r - mean, 2)).average().orElse(0.0);
        return Math.sqrt(variance) * 100.0;
    }

    private static List<SymbolPerformance> symbolPerformance(Portfolio portfolio, List<Transaction> completed,
                                                             Instant now) {
        var result = new ArrayList<SymbolPerformance>();
        for (HoldingValuation holding : portfolio.holdings()) {
            double realized = 0;
            double bestPrice = Double.NaN;
            double worstPrice = Double.NaN;
            Instant firstPurchase = null;
            Instant lastTransaction = null;
            int running = 0;

            for (Transaction tx : completed) {
                if (!tx.symbol().equals(holding.symbol())) {
                    continue;
                }
                if (tx.type() == TransactionType.BUY) {
                    // Holding period restarts when the position was fully closed
                    if (running == 0) {
                        firstPurchase = tx.timestamp();
                    }
                    running += tx.quantity();
                } else {
                    running -= tx.quantity();
                    if (tx.realizedGainLoss() != null) {
                        realized += tx.realizedGainLoss();
                    }
                }
                bestPrice = Double.isNaN(bestPrice) ? tx.price() : Math.max(bestPrice, tx.price());
                worstPrice = Double.isNaN(worstPrice) ? tx.price() : Math.min(worstPrice, tx.price());
                lastTransaction = tx.timestamp();
            }

            long daysHeld = firstPurchase == null ? 0 : Duration.between(firstPurchase, now).toDays();
            result.add(new SymbolPerformance(
                holding.symbol(),
                holding.quantity(),
                holding.averagePrice(),
                holding.totalCost(),
                holding.currentValue(),
                holding.gainLoss(),
                holding.gainLossPercent(),
                realized,
                Double.isNaN(bestPrice) ? holding.averagePrice() : bestPrice,
                Double.isNaN(worstPrice) ? holding.averagePrice() : worstPrice,
                firstPurchase,
                lastTransaction,
                daysHeld,
                holding.priced()
            ));
        }
        return result;
    }

    /**
     * Percentages are 0-100. {@code averageLoss} is a magnitude, {@code largestLoss}
     * is the most negative closed trade. Profit factor is 0 when nothing was lost.
     */
    public record PerformanceReport(
        int closedTrades,
        int winningTrades,
        int losingTrades,
        double winRate,
        double averageWin,
        double averageLoss,
        double profitFactor,
        double largestWin,
        double largestLoss,
        double totalVolume,
        double realizedGainLoss,
        double unrealizedGainLoss,
        double maxDrawdown,
        double volatility,
        Instant sessionStart,
        double sessionHours,
        double tradesPerHour,
        SymbolPerformance bestPerformer,
        SymbolPerformance worstPerformer,
        List<SymbolPerformance> holdings
    ) {
        public PerformanceReport {
            holdings = List.copyOf(holdings);
        }
    }

    public record SymbolPerformance(
        String symbol,
        int quantity,
        double averagePrice,
        double totalCost,
        double currentValue,
        double unrealizedGainLoss,
        double unrealizedGainLossPercent,
        double realizedGainLoss,
        double bestPrice,
        double worstPrice,
        Instant firstPurchase,
        Instant lastTransaction,
        long daysHeld,
        boolean priced
    ) {
    }
}
