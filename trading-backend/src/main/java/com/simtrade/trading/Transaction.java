package com.simtrade.trading;

import java.time.Instant;

/**
 * Immutable record of one trade.
 *
 * @param totalAmount      price x quantity, before fees
 * @param balanceBefore    cash before the trade
 * @param balanceAfter     cash after the trade settles
 * @param realizedGainLoss sells only: (price - average cost) x quantity - fee
 * @param failureReason    set only on FAILED transactions
 */
public record Transaction(
    String id,
    String symbol,
    TransactionType type,
    int quantity,
    double price,
    double totalAmount,
    double fee,
    Instant timestamp,
    TransactionStatus status,
    double balanceBefore,
    double balanceAfter,
    Double realizedGainLoss,
    String failureReason
) {
    /**
     * Copy with a new status. Rejects transitions out of a terminal state.
     */
    public Transaction withStatus(TransactionStatus next, String reason) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Transaction " + id + " cannot move from " + status + " to " + next);
        }
        return new Transaction(id, symbol, type, quantity, price, totalAmount, fee, timestamp, next,
            balanceBefore, balanceAfter, realizedGainLoss, reason);
    }

    /**
     * Signed change to cash: buys pay amount plus fee, sells receive amount less fee.
     */
    public double netCashDelta() {
        return switch (type) {
            case BUY -> -(totalAmount + fee);
            case SELL -> totalAmount - fee;
        };
    }
}
