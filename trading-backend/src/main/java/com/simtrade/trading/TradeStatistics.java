package com.simtrade.trading;

import com.simtrade.portfolio.Portfolio;

import java.util.List;

/**
 * Summary of the session's trading activity.
 */
public record TradeStatistics(
    int totalHoldings,
    int totalTransactions,
    long completedTransactions,
    long failedTransactions,
    long buyCount,
    long sellCount,
    double totalFees,
    double realizedGainLoss,
    double totalValue,
    double totalGainLoss,
    double totalGainLossPercent,
    boolean processing
) {
    public static TradeStatistics from(Portfolio portfolio, List<Transaction> transactions, boolean processing) {
        long completed = 0;
        long failed = 0;
        long buys = 0;
        long sells = 0;
        double fees = 0;
        double realized = 0;

        for (Transaction tx : transactions) {
            if (tx.status() == TransactionStatus.FAILED) {
                failed++;
                continue;
            }
            if (tx.status() != TransactionStatus.COMPLETED) {
                continue;
            }
            completed++;
            fees += tx.fee();
            if (tx.type() == TransactionType.BUY) {
                buys++;
            } else {
                sells++;
                if (tx.realizedGainLoss() != null) {
                    realized += tx.realizedGainLoss();
                }
            }
        }

        return new TradeStatistics(portfolio.holdings().size(), transactions.size(), completed, failed,
            buys, sells, fees, realized, portfolio.totalValue(), portfolio.totalGainLoss(),
            portfolio.totalGainLossPercent(), processing);
    }
}
