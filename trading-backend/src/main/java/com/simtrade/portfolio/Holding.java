package com.simtrade.portfolio;

import java.time.Instant;

/**
 * Shares held in one symbol at their weighted-average cost.
 * {@code totalCost} is always {@code averagePrice * quantity}.
 */
public record Holding(
    String symbol,
    int quantity,
    double averagePrice,
    double totalCost,
    double lastTradePrice,
    Instant lastTradeDate
) {
    public static Holding opened(String symbol, int quantity, double price, Instant at) {
        return new Holding(symbol, quantity, price, price * quantity, price, at);
    }

    /**
     * Add shares, blending the purchase into the average cost.
     */
    public Holding withBuy(int shares, double price, Instant at) {
        int newQuantity = quantity + shares;
        double newAverage = (totalCost + shares * price) / newQuantity;
        return new Holding(symbol, newQuantity, newAverage, newAverage * newQuantity, price, at);
    }

    /**
     * Remove shares. The average cost of what remains does not change.
     */
    public Holding withSell(int shares, double price, Instant at) {
        int newQuantity = quantity - shares;
        return new Holding(symbol, newQuantity, averagePrice, averagePrice * newQuantity, price, at);
    }
}
