package com.simtrade.trading;

/**
 * Lifecycle of a transaction. Only PENDING moves, and only forward.
 */
public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean canTransitionTo(TransactionStatus next) {
        return this == PENDING && (next == COMPLETED || next == FAILED);
    }
}
