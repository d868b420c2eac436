package com.simtrade.sync;

import com.simtrade.trading.Transaction;

import java.util.function.Consumer;

/**
 * A named destination the dispatcher copies completed transactions to.
 */
public record SyncTarget(String name, Consumer<Transaction> action) {

    public static SyncTarget backend(TransactionSync sync) {
        return new SyncTarget("backend", sync::persist);
    }

    public static SyncTarget audit(AuditRecorder recorder) {
        return new SyncTarget("audit", recorder::record);
    }
}
