package com.simtrade.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Centralized metrics for the trading backend.
 *
 * Provides:
 * - Prometheus-compatible metrics when backed by a {@link PrometheusMeterRegistry}
 * - Trade, failure and sync counters plus trade latency
 * - Metrics scraping endpoint
 *
 * Usage:
 *   var metrics = MetricsService.prometheus();
 *   metrics.recordTradeExecuted("BUY", "AAPL", 600.0);
 *   metrics.recordTradeLatency("BUY", duration);
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final MeterRegistry registry;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        logger.info("MetricsService initialized with {}", registry.getClass().getSimpleName());
    }

    public static MetricsService prometheus() {
        return new MetricsService(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Get Prometheus-formatted metrics for scraping. Empty for other registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    public void recordTradeExecuted(String type, String symbol, double amount) {
        registry.counter("trading.trades.executed",
            "type", type,
            "symbol", symbol).increment();

        registry.summary("trading.trade.value",
            "type", type).record(amount);
    }

    public void recordTradeRejected(String type, String code) {
        registry.counter("trading.trades.rejected",
            "type", type,
            "code", code).increment();
    }

    public void recordTradeLatency(String type, Duration duration) {
        registry.timer("trading.trade.latency",
            "type", type).record(duration);
    }

    public void recordTradeWarning(String type) {
        registry.counter("trading.trades.warnings",
            "type", type).increment();
    }

    public void recordSyncSuccess(String target) {
        registry.counter("trading.sync.success",
            "target", target).increment();
    }

    public void recordSyncFailure(String target, String reason) {
        registry.counter("trading.sync.failures",
            "target", target,
            "reason", reason).increment();
    }
}
