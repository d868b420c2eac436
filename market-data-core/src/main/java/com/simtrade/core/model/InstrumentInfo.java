package com.simtrade.core.model;

/**
 * Display metadata for a tradable instrument.
 */
public record InstrumentInfo(String symbol, String name, String sector, AssetClass assetClass) {

    public boolean isCrypto() {
        return assetClass == AssetClass.CRYPTO;
    }
}
