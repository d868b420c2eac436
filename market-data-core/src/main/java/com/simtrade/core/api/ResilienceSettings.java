package com.simtrade.core.api;

import java.time.Duration;

/**
 * Retry, circuit-breaker and adapter-cache settings applied to every provider.
 *
 * @param maxAttempts        total attempts including the first call
 * @param initialBackoff     delay before the first retry
 * @param backoffMultiplier  growth factor per retry
 * @param maxBackoff         cap on any single delay
 * @param jitter             randomisation factor applied to each delay (0.2 = ±20%)
 * @param adapterCacheTtl    how long an adapter reuses its last answer for a symbol
 * @param breakerWaitInOpen  how long an open breaker rejects calls before probing
 */
public record ResilienceSettings(
    int maxAttempts,
    Duration initialBackoff,
    double backoffMultiplier,
    Duration maxBackoff,
    double jitter,
    Duration adapterCacheTtl,
    Duration breakerWaitInOpen
) {
    public static final ResilienceSettings DEFAULTS = new ResilienceSettings(
        3, Duration.ofMillis(1000), 2.0, Duration.ofMillis(8000), 0.2,
        Duration.ofSeconds(30), Duration.ofSeconds(30));

    public ResilienceSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
    }
}
