package com.simtrade.portfolio;

/**
 * A holding marked to the current price. Holdings without a price are marked
 * at cost and flagged {@code priced=false}.
 */
public record HoldingValuation(
    String symbol,
    int quantity,
    double averagePrice,
    double totalCost,
    double currentPrice,
    double currentValue,
    double gainLoss,
    double gainLossPercent,
    boolean priced
) {
    static HoldingValuation of(Holding holding, Double price) {
        double mark = price != null ? price : holding.averagePrice();
        double value = mark * holding.quantity();
        double gainLoss = value - holding.totalCost();
        double percent = holding.totalCost() > 0 ? gainLoss / holding.totalCost() * 100.0 : 0.0;
        return new HoldingValuation(holding.symbol(), holding.quantity(), holding.averagePrice(),
            holding.totalCost(), mark, value, gainLoss, percent, price != null);
    }
}
