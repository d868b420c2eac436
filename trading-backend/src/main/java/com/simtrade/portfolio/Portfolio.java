package com.simtrade.portfolio;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Point-in-time valuation of every holding. Derived on demand, never stored.
 */
public record Portfolio(
    List<HoldingValuation> holdings,
    double totalCost,
    double totalValue,
    double totalGainLoss,
    double totalGainLossPercent,
    Set<String> unpricedSymbols,
    Instant lastUpdated
) {
    public Portfolio {
        holdings = List.copyOf(holdings);
        unpricedSymbols = Set.copyOf(unpricedSymbols);
    }
}
