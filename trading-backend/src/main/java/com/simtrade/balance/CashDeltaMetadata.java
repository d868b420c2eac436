package com.simtrade.balance;

import com.simtrade.trading.TransactionType;

public record CashDeltaMetadata(String transactionId, String description, TransactionType type) {
}
