package com.simtrade.sync;

import com.simtrade.trading.Transaction;

/**
 * Records transactions in an append-only external audit trail.
 */
public interface AuditRecorder {

    /**
     * @throws SyncException when the recorder rejects or cannot be reached
     */
    void record(Transaction transaction);
}
