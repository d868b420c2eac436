package com.simtrade.balance;

/**
 * Cash on hand. Stock and total values are filled in only by services that know them.
 */
public record BalanceSnapshot(double cash, Double stockValue, Double totalValue) {

    public static BalanceSnapshot cashOnly(double cash) {
        return new BalanceSnapshot(cash, null, null);
    }
}
