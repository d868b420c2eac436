package com.simtrade.trading;

import java.util.Optional;

/**
 * Share and notional limits plus the fee schedule.
 *
 * @param minShares          smallest order, in whole shares
 * @param maxShares          largest order, in whole shares
 * @param minAmount          smallest order value
 * @param maxAmount          largest order value
 * @param largeTradeWarning  order value above which a warning is attached
 * @param feeRate            fee as a fraction of order value
 * @param minFee             floor for the fee
 */
public record TradeLimits(
    int minShares,
    int maxShares,
    double minAmount,
    double maxAmount,
    double largeTradeWarning,
    double feeRate,
    double minFee
) {
    public static final TradeLimits DEFAULTS = new TradeLimits(1, 100_000, 1.0, 10_000_000.0, 100_000.0, 0.001, 1.0);

    public TradeLimits {
        if (minShares < 1 || maxShares < minShares) {
            throw new IllegalArgumentException("Invalid share limits: " + minShares + ".." + maxShares);
        }
        if (minAmount < 0 || maxAmount < minAmount) {
            throw new IllegalArgumentException("Invalid amount limits: " + minAmount + ".." + maxAmount);
        }
        if (feeRate < 0 || minFee < 0) {
            throw new IllegalArgumentException("Fees cannot be negative");
        }
    }

    public double fee(double amount) {
        return Math.max(amount * feeRate, minFee);
    }

    public Optional<String> quantityViolation(double quantity) {
        if (quantity != Math.rint(quantity) || Double.isInfinite(quantity)) {
            return Optional.of("Quantity must be a whole number of shares");
        }
        if (quantity < minShares) {
            return Optional.of(String.format("Minimum %d share(s) required", minShares));
        }
        if (quantity > maxShares) {
            return Optional.of(String.format("Maximum %,d shares per transaction", maxShares));
        }
        return Optional.empty();
    }

    public Optional<String> amountViolation(double amount) {
        if (amount < minAmount) {
            return Optional.of(String.format("Minimum transaction amount is %.2f", minAmount));
        }
        if (amount > maxAmount) {
            return Optional.of(String.format("Maximum transaction amount is %,.2f", maxAmount));
        }
        return Optional.empty();
    }

    public boolean isLargeTrade(double amount) {
        return amount > largeTradeWarning;
    }
}
