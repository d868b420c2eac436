package com.simtrade.core.model;

public enum AssetClass {
    EQUITY,
    CRYPTO
}
