package com.simtrade.trading;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a buy or sell. Failures carry a typed error and no transaction,
 * except TRANSACTION_FAILED which carries the FAILED transaction.
 * Successes may carry warnings (large trade, sync trouble).
 */
public record TradeResult(
    boolean success,
    Transaction transaction,
    TradeError error,
    List<String> warnings
) {
    public TradeResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static TradeResult success(Transaction transaction, List<String> warnings) {
        return new TradeResult(true, transaction, null, warnings);
    }

    public static TradeResult failure(TradeErrorCode code, String message) {
        return failure(code, message, null);
    }

    public static TradeResult failure(TradeErrorCode code, String message, Transaction transaction) {
        return new TradeResult(false, transaction, new TradeError(code, message, Instant.now()), List.of());
    }

    public TradeErrorCode errorCode() {
        return error == null ? null : error.code();
    }
}
