package com.simtrade.sync;

import com.simtrade.trading.Transaction;

/**
 * Writes completed transactions to the persistent backend.
 */
public interface TransactionSync {

    /**
     * @throws SyncException when the backend rejects or cannot be reached
     */
    void persist(Transaction transaction);
}
