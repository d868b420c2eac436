package com.simtrade.core.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Per-provider call budget for upstream feeds.
 *
 * Features:
 * - Fixed budget of calls per window for each provider
 * - Minimum spacing between consecutive calls to the same provider
 * - Windows reset on a fixed-rate timer, so unused budget never banks
 * - Non-blocking: a denied caller is told immediately and falls back to cache
 *
 * Denial is not an error. Callers treat it as "use what you already have".
 */
public final class RateGovernor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RateGovernor.class);

    public static final Limits DEFAULT_LIMITS = new Limits(5, Duration.ofMillis(2000));

    private final Limits defaultLimits;
    private final Map<String, Limits> providerLimits;
    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile ScheduledExecutorService resetScheduler;

    public RateGovernor() {
        this(DEFAULT_LIMITS, Map.of(), Clock.systemUTC());
    }

    public RateGovernor(Limits defaultLimits, Map<String, Limits> providerLimits, Clock clock) {
        this.defaultLimits = defaultLimits;
        this.providerLimits = Map.copyOf(providerLimits);
        this.clock = clock;
        logger.info("RateGovernor initialized: default {} calls/window, {}ms spacing, {} provider overrides",
            defaultLimits.callsPerWindow(), defaultLimits.minSpacing().toMillis(), providerLimits.size());
    }

    /**
     * Ask for permission to call a provider. A grant is recorded against the
     * provider's window before this method returns.
     */
    public boolean tryAcquire(String providerId) {
        long now = clock.millis();
        var window = windows.computeIfAbsent(providerId, id -> new RateWindow(now));
        boolean granted = window.tryAcquire(now, limitsFor(providerId));
        if (!granted) {
            logger.debug("Rate budget exhausted for {}", providerId);
        }
        return granted;
    }

    public Limits limitsFor(String providerId) {
        return providerLimits.getOrDefault(providerId, defaultLimits);
    }

    /**
     * Reset every provider window. Invoked by the window timer.
     */
    public void resetWindows() {
        long now = clock.millis();
        windows.values().forEach(window -> window.reset(now));
        logger.trace("Rate windows reset for {} providers", windows.size());
    }

    /**
     * Start the fixed-rate window timer.
     */
    public synchronized void start(Duration windowLength) {
        if (resetScheduler != null) {
            return;
        }
        resetScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "rate-governor-reset");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = windowLength.toMillis();
        resetScheduler.scheduleAtFixedRate(this::resetWindows, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.info("Rate window timer started: every {}ms", periodMs);
    }

    public Optional<WindowSnapshot> snapshot(String providerId) {
        return Optional.ofNullable(windows.get(providerId)).map(window -> window.snapshot(providerId));
    }

    @Override
    public synchronized void close() {
        if (resetScheduler != null) {
            resetScheduler.shutdownNow();
            resetScheduler = null;
        }
    }

    /**
     * Budget for one provider.
     */
    public record Limits(int callsPerWindow, Duration minSpacing) {
        public Limits {
            if (callsPerWindow < 0) {
                throw new IllegalArgumentException("callsPerWindow must be >= 0");
            }
            if (minSpacing == null || minSpacing.isNegative()) {
                throw new IllegalArgumentException("minSpacing must be >= 0");
            }
        }
    }

    /**
     * Point-in-time view of a provider window, for health and metrics.
     * {@code lastCallAt} is -1 when the provider has never been called.
     */
    public record WindowSnapshot(String providerId, int callsInWindow, long windowStart, long lastCallAt, long denials) {
    }
}
