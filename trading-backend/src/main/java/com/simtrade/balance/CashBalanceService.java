package com.simtrade.balance;

/**
 * Source of truth for the player's cash.
 */
public interface CashBalanceService {

    BalanceSnapshot getBalance();

    /**
     * Apply a signed change to cash.
     *
     * @throws IllegalStateException if the change would overdraw the balance
     */
    void applyDelta(double amount, CashDeltaMetadata metadata);
}
