package com.simtrade.portfolio;

import com.simtrade.core.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holdings keyed by symbol with weighted-average cost accounting.
 *
 * Thread-Safety: each mutation is a single {@link ConcurrentHashMap#compute} so
 * readers never see a half-applied trade. Callers are expected to validate
 * quantities before selling.
 */
public final class PortfolioLedger {
    private static final Logger logger = LoggerFactory.getLogger(PortfolioLedger.class);

    private final ConcurrentHashMap<String, Holding> holdings = new ConcurrentHashMap<>();
    private final Clock clock;

    public PortfolioLedger() {
        this(Clock.systemUTC());
    }

    public PortfolioLedger(Clock clock) {
        this.clock = clock;
    }

    public Holding applyBuy(String symbol, int quantity, double price) {
        requirePositive(quantity, price);
        String key = Symbols.normalize(symbol);
        var now = clock.instant();
        Holding updated = holdings.compute(key, (k, existing) -> existing == null
            ? Holding.opened(k, quantity, price, now)
            : existing.withBuy(quantity, price, now));
        logger.debug("Bought {} {} @ {} -> {} @ avg {}", quantity, key, price, updated.quantity(), updated.averagePrice());
        return updated;
    }

    /**
     * @return the remaining holding, or empty when the position was closed
     */
    public Optional<Holding> applySell(String symbol, int quantity, double price) {
        requirePositive(quantity, price);
        String key = Symbols.normalize(symbol);
        var now = clock.instant();
        Holding remaining = holdings.compute(key, (k, existing) -> {
            if (existing == null || existing.quantity() < quantity) {
                throw new IllegalStateException("Cannot sell " + quantity + " " + k + ": only "
                    + (existing == null ? 0 : existing.quantity()) + " held");
            }
            Holding after = existing.withSell(quantity, price, now);
            return after.quantity() == 0 ? null : after;
        });
        logger.debug("Sold {} {} @ {} -> {} left", quantity, key, price, remaining == null ? 0 : remaining.quantity());
        return Optional.ofNullable(remaining);
    }

    public Optional<Holding> getHolding(String symbol) {
        return Optional.ofNullable(holdings.get(Symbols.normalize(symbol)));
    }

    /**
     * Holdings sorted by symbol.
     */
    public List<Holding> holdings() {
        var list = new ArrayList<>(holdings.values());
        list.sort(Comparator.comparing(Holding::symbol));
        return list;
    }

    public Collection<String> symbols() {
        return new LinkedHashSet<>(holdings.keySet());
    }

    /**
     * Value every holding against the given prices.
     */
    public Portfolio snapshot(Map<String, Double> prices) {
        var valuations = new ArrayList<HoldingValuation>();
        var unpriced = new LinkedHashSet<String>();
        double totalCost = 0;
        double totalValue = 0;

        for (Holding holding : holdings()) {
            Double price = prices.get(holding.symbol());
            if (price == null) {
                unpriced.add(holding.symbol());
            }
            var valuation = HoldingValuation.of(holding, price);
            valuations.add(valuation);
            totalCost += valuation.totalCost();
            totalValue += valuation.currentValue();
        }

        double gainLoss = totalValue - totalCost;
        double percent = totalCost > 0 ? gainLoss / totalCost * 100.0 : 0.0;
        return new Portfolio(valuations, totalCost, totalValue, gainLoss, percent, unpriced, clock.instant());
    }

    /**
     * Replace the ledger contents, e.g. from the journal at startup.
     */
    public void restore(Collection<Holding> saved) {
        holdings.clear();
        for (Holding holding : saved) {
            if (holding.quantity() > 0) {
                holdings.put(Symbols.normalize(holding.symbol()), holding);
            }
        }
        logger.info("Portfolio restored with {} holdings", holdings.size());
    }

    public void clear() {
        holdings.clear();
    }

    public int size() {
        return holdings.size();
    }

    private static void requirePositive(int quantity, double price) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
    }
}
