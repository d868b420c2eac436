package com.simtrade.balance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process cash balance for a single player session.
 */
public final class InMemoryCashBalance implements CashBalanceService {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCashBalance.class);
    private static final double EPSILON = 1e-9;

    private final ReentrantLock lock = new ReentrantLock();
    private double cash;

    public InMemoryCashBalance(double initialCash) {
        if (initialCash < 0) {
            throw new IllegalArgumentException("Initial cash cannot be negative: " + initialCash);
        }
        this.cash = initialCash;
        logger.info("💰 Cash balance initialized at {}", String.format("%.2f", initialCash));
    }

    @Override
    public BalanceSnapshot getBalance() {
        lock.lock();
        try {
            return BalanceSnapshot.cashOnly(cash);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void applyDelta(double amount, CashDeltaMetadata metadata) {
        lock.lock();
        try {
            double next = cash + amount;
            if (next < -EPSILON) {
                throw new IllegalStateException(String.format(
                    "Insufficient cash for %s: balance %.2f, change %.2f",
                    metadata.transactionId(), cash, amount));
            }
            cash = Math.max(0.0, next);
            logger.debug("Cash change {} -> {} ({})", amount, cash, metadata.description());
        } finally {
            lock.unlock();
        }
    }
}
