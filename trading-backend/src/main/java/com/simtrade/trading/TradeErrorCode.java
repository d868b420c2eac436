package com.simtrade.trading;

public enum TradeErrorCode {
    INVALID_SYMBOL,
    INVALID_QUANTITY,
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_SHARES,
    PRICE_UNAVAILABLE,
    TRANSACTION_IN_PROGRESS,
    VALIDATION_FAILED,
    TRANSACTION_FAILED
}
