package com.simtrade.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalogue of instruments the game lists for trading.
 *
 * Any symbol can be quoted; the catalogue supplies display names and
 * decides which asset class a symbol belongs to for provider routing.
 */
public final class InstrumentCatalog {

    /**
     * Crypto tickers recognised even when they are not listed in the catalogue.
     */
    private static final Set<String> KNOWN_CRYPTO = Set.of(
        "BTC", "ETH", "USDT", "BNB", "SOL", "XRP", "ADA", "AVAX", "DOT", "MATIC",
        "LINK", "UNI", "LTC", "ICP", "ATOM", "XLM", "TRX", "NEAR", "ALGO", "VET",
        "AAVE", "MKR", "SNX", "CRV", "COMP", "DOGE", "SHIB", "USDC", "DAI", "BUSD"
    );

    private final Map<String, InstrumentInfo> instruments;

    public InstrumentCatalog(List<InstrumentInfo> instruments) {
        var bySymbol = new LinkedHashMap<String, InstrumentInfo>();
        for (InstrumentInfo info : instruments) {
            bySymbol.put(Symbols.normalize(info.symbol()), info);
        }
        this.instruments = Map.copyOf(bySymbol);
    }

    public static InstrumentCatalog defaultCatalog() {
        return new InstrumentCatalog(List.of(
            equity("AAPL", "Apple Inc.", "Technology"),
            equity("MSFT", "Microsoft Corporation", "Technology"),
            equity("GOOGL", "Alphabet Inc.", "Technology"),
            equity("AMZN", "Amazon.com Inc.", "Consumer Discretionary"),
            equity("TSLA", "Tesla Inc.", "Automotive"),
            equity("META", "Meta Platforms Inc.", "Technology"),
            equity("NVDA", "NVIDIA Corporation", "Technology"),
            equity("NFLX", "Netflix Inc.", "Communication Services"),
            equity("JPM", "JPMorgan Chase & Co.", "Financials"),
            equity("BAC", "Bank of America Corporation", "Financials"),
            equity("V", "Visa Inc.", "Financials"),
            equity("MA", "Mastercard Incorporated", "Financials"),
            equity("JNJ", "Johnson & Johnson", "Healthcare"),
            equity("PFE", "Pfizer Inc.", "Healthcare"),
            equity("UNH", "UnitedHealth Group Incorporated", "Healthcare"),
            equity("XOM", "Exxon Mobil Corporation", "Energy"),
            equity("CVX", "Chevron Corporation", "Energy"),
            equity("WMT", "Walmart Inc.", "Consumer Staples"),
            equity("HD", "The Home Depot Inc.", "Consumer Discretionary"),
            crypto("BTC", "Bitcoin"),
            crypto("ETH", "Ethereum"),
            crypto("ADA", "Cardano"),
            crypto("DOT", "Polkadot"),
            crypto("SOL", "Solana"),
            crypto("AVAX", "Avalanche"),
            crypto("MATIC", "Polygon"),
            crypto("LINK", "Chainlink"),
            crypto("UNI", "Uniswap"),
            crypto("LTC", "Litecoin"),
            crypto("ICP", "Internet Computer")
        ));
    }

    public List<InstrumentInfo> all() {
        return instruments.values().stream()
            .sorted((a, b) -> a.symbol().compareTo(b.symbol()))
            .toList();
    }

    public Optional<InstrumentInfo> find(String symbol) {
        return Optional.ofNullable(instruments.get(Symbols.normalize(symbol)));
    }

    public AssetClass assetClassOf(String symbol) {
        String normalized = Symbols.normalize(symbol);
        return find(normalized)
            .map(InstrumentInfo::assetClass)
            .orElse(KNOWN_CRYPTO.contains(normalized) ? AssetClass.CRYPTO : AssetClass.EQUITY);
    }

    public boolean isCrypto(String symbol) {
        return assetClassOf(symbol) == AssetClass.CRYPTO;
    }

    private static InstrumentInfo equity(String symbol, String name, String sector) {
        return new InstrumentInfo(symbol, name, sector, AssetClass.EQUITY);
    }

    private static InstrumentInfo crypto(String symbol, String name) {
        return new InstrumentInfo(symbol, name, "Cryptocurrency", AssetClass.CRYPTO);
    }
}
