package com.simtrade.health;

import com.simtrade.core.api.ResilientQuoteProvider;
import com.simtrade.persistence.TransactionJournal;
import com.simtrade.sync.SyncDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health check service for monitoring system components.
 *
 * An open provider breaker only degrades the service: other providers and the
 * cache still price symbols. A broken journal takes it down.
 */
public final class HealthCheckService {
    private static final Logger logger = LoggerFactory.getLogger(HealthCheckService.class);

    private final List<ResilientQuoteProvider> providers;
    private final TransactionJournal journal;
    private final SyncDispatcher syncDispatcher;
    private final Clock clock;

    public HealthCheckService(List<ResilientQuoteProvider> providers, TransactionJournal journal,
                              SyncDispatcher syncDispatcher, Clock clock) {
        this.providers = List.copyOf(providers);
        this.journal = journal;
        this.syncDispatcher = syncDispatcher;
        this.clock = clock;
    }

    /**
     * Perform health check of all system components.
     */
    public HealthStatus getHealth() {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();

        for (ResilientQuoteProvider provider : providers) {
            components.put("provider_" + provider.id(), checkProvider(provider));
        }
        components.put("journal", checkJournal());
        components.put("sync_queue", checkSyncQueue());

        boolean allHealthy = components.values().stream()
            .allMatch(c -> c.status() == Status.UP);

        boolean anyDown = components.values().stream()
            .anyMatch(c -> c.status() == Status.DOWN);

        Status overallStatus = allHealthy ? Status.UP :
                               anyDown ? Status.DOWN : Status.DEGRADED;

        return new HealthStatus(overallStatus, clock.instant(), components);
    }

    private ComponentHealth checkProvider(ResilientQuoteProvider provider) {
        String state = provider.getCircuitBreakerState();
        Status status = switch (state) {
            case "CLOSED" -> Status.UP;
            default -> Status.DEGRADED;
        };
        return new ComponentHealth(status, "Circuit breaker: " + state, null);
    }

    private ComponentHealth checkJournal() {
        try {
            int count = journal.countTransactions();
            return new ComponentHealth(Status.UP, "Journal accessible (" + count + " transactions)", null);
        } catch (Exception e) {
            logger.error("Journal health check failed", e);
            return new ComponentHealth(Status.DOWN, "Journal error", e.getMessage());
        }
    }

    private ComponentHealth checkSyncQueue() {
        int pending = syncDispatcher.pendingCount();
        int capacity = syncDispatcher.queueCapacity();
        Status status = pending >= capacity ? Status.DEGRADED : Status.UP;
        return new ComponentHealth(status, pending + "/" + capacity + " queued", null);
    }

    /**
     * Health status enumeration.
     */
    public enum Status {
        UP,       // All systems operational
        DEGRADED, // Some issues but functional
        DOWN      // Critical failure
    }

    /**
     * Overall health status record.
     */
    public record HealthStatus(
        Status status,
        Instant timestamp,
        Map<String, ComponentHealth> components
    ) {
    }

    /**
     * Individual component health record.
     */
    public record ComponentHealth(
        Status status,
        String message,
        String error
    ) {
    }
}
