package com.simtrade.portfolio;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PortfolioLedger
 * Tests weighted-average cost accounting and portfolio valuation
 */
@DisplayName("PortfolioLedger Tests")
class PortfolioLedgerTest {

    private static final double DELTA = 0.0001;
    private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");

    private PortfolioLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PortfolioLedger(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Buys at different prices average the cost")
    void testWeightedAverage() {
        ledger.applyBuy("AAPL", 10, 100.0);
        Holding holding = ledger.applyBuy("AAPL", 10, 200.0);

        assertEquals(20, holding.quantity());
        assertEquals(150.0, holding.averagePrice(), DELTA);
        assertEquals(3000.0, holding.totalCost(), DELTA);
        assertEquals(200.0, holding.lastTradePrice(), DELTA);
        assertEquals(NOW, holding.lastTradeDate());
    }

    @Test
    @DisplayName("Partial sell keeps the average cost")
    void testPartialSell() {
        ledger.applyBuy("AAPL", 10, 100.0);
        ledger.applyBuy("AAPL", 10, 200.0);

        Holding remaining = ledger.applySell("aapl", 5, 500.0).orElseThrow();

        assertEquals(15, remaining.quantity());
        assertEquals(150.0, remaining.averagePrice(), DELTA);
        assertEquals(2250.0, remaining.totalCost(), DELTA);
    }

    @Test
    @DisplayName("Selling everything removes the holding")
    void testSellExhaustion() {
        ledger.applyBuy("BTC", 3, 50000.0);

        assertTrue(ledger.applySell("BTC", 3, 51000.0).isEmpty());
        assertTrue(ledger.getHolding("BTC").isEmpty());
        assertEquals(0, ledger.size());
    }

    @Test
    @DisplayName("Overselling is refused and leaves the holding untouched")
    void testOversell() {
        ledger.applyBuy("MSFT", 2, 400.0);

        assertThrows(IllegalStateException.class, () -> ledger.applySell("MSFT", 3, 400.0));
        assertEquals(2, ledger.getHolding("MSFT").orElseThrow().quantity());
    }

    @Test
    @DisplayName("Non-positive quantities and prices are rejected")
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> ledger.applyBuy("AAPL", 0, 100.0));
        assertThrows(IllegalArgumentException.class, () -> ledger.applyBuy("AAPL", 1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> ledger.applyBuy("AAPL", 1, Double.NaN));
    }

    @Test
    @DisplayName("Snapshot values holdings at current prices")
    void testSnapshot() {
        ledger.applyBuy("AAPL", 2, 300.0);
        ledger.applyBuy("ETH", 1, 2000.0);

        Portfolio portfolio = ledger.snapshot(Map.of("AAPL", 330.0, "ETH", 1800.0));

        assertEquals(2, portfolio.holdings().size());
        assertEquals("AAPL", portfolio.holdings().get(0).symbol(), "Sorted by symbol");
        assertEquals(2600.0, portfolio.totalCost(), DELTA);
        assertEquals(2460.0, portfolio.totalValue(), DELTA);
        assertEquals(-140.0, portfolio.totalGainLoss(), DELTA);
        assertEquals(-140.0 / 2600.0 * 100.0, portfolio.totalGainLossPercent(), DELTA);
        assertEquals(10.0, portfolio.holdings().get(0).gainLossPercent(), DELTA);
        assertTrue(portfolio.unpricedSymbols().isEmpty());
    }

    @Test
    @DisplayName("Holdings without a price are valued at cost and flagged")
    void testUnpricedHolding() {
        ledger.applyBuy("AAPL", 2, 300.0);

        Portfolio portfolio = ledger.snapshot(Map.of());

        var valuation = portfolio.holdings().get(0);
        assertFalse(valuation.priced());
        assertEquals(600.0, valuation.currentValue(), DELTA);
        assertEquals(0.0, portfolio.totalGainLoss(), DELTA);
        assertEquals(java.util.Set.of("AAPL"), portfolio.unpricedSymbols());
    }

    @Test
    @DisplayName("Restore replaces contents and skips empty holdings")
    void testRestore() {
        ledger.applyBuy("TSLA", 1, 200.0);

        ledger.restore(List.of(
            new Holding("AAPL", 4, 100.0, 400.0, 110.0, NOW),
            new Holding("MSFT", 0, 0.0, 0.0, 300.0, NOW)));

        assertEquals(1, ledger.size());
        assertTrue(ledger.getHolding("TSLA").isEmpty());
        assertEquals(400.0, ledger.getHolding("AAPL").orElseThrow().totalCost(), DELTA);
    }
}
