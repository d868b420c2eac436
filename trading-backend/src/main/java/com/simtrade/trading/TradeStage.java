package com.simtrade.trading;

/**
 * Where the engine is in the current (or last) trade.
 */
public enum TradeStage {
    IDLE,
    VALIDATING,
    PRICING,
    MUTATING,
    SYNCING,
    COMPLETED,
    FAILED
}
