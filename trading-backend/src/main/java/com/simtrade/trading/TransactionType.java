package com.simtrade.trading;

public enum TransactionType {
    BUY,
    SELL
}
