package com.simtrade.sync;

import com.simtrade.metrics.MetricsService;
import com.simtrade.trading.Transaction;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fire-and-forget delivery of completed transactions to remote targets.
 *
 * Features:
 * - Bounded queue: a full queue rejects immediately instead of blocking the trade
 * - Retry with exponential backoff per target (resilience4j)
 * - Failures are logged and counted, never propagated; local state is not rolled back
 */
public final class SyncDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SyncDispatcher.class);

    private final List<SyncTarget> targets;
    private final ThreadPoolExecutor executor;
    private final Retry retry;
    private final MetricsService metrics;
    private final int queueCapacity;

    public SyncDispatcher(List<SyncTarget> targets, int queueCapacity, int maxAttempts,
                          Duration initialBackoff, MetricsService metrics) {
        this.targets = List.copyOf(targets);
        this.metrics = metrics;
        this.queueCapacity = queueCapacity;

        var threadCounter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(1, 2, 30, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            r -> {
                var thread = new Thread(r, "tx-sync-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            },
            new ThreadPoolExecutor.AbortPolicy());

        var retryConfig = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff.toMillis(), 2.0))
            .retryExceptions(SyncException.class)
            .build();
        this.retry = Retry.of("transaction-sync", retryConfig);

        logger.info("SyncDispatcher initialized: targets {}, queue {}, {} attempts",
            this.targets.stream().map(SyncTarget::name).toList(), queueCapacity, maxAttempts);
    }

    /**
     * Queue delivery of a transaction to every target.
     *
     * @return false if the queue was full (or the dispatcher closed) for any target
     */
    public boolean dispatch(Transaction transaction) {
        boolean accepted = true;
        for (SyncTarget target : targets) {
            try {
                executor.execute(() -> deliver(target, transaction));
            } catch (RejectedExecutionException e) {
                accepted = false;
                metrics.recordSyncFailure(target.name(), "QueueFull");
                logger.warn("⚠️ Sync queue full, {} not sent to {}", transaction.id(), target.name());
            }
        }
        return accepted;
    }

    private void deliver(SyncTarget target, Transaction transaction) {
        try {
            Retry.decorateRunnable(retry, () -> target.action().accept(transaction)).run();
            metrics.recordSyncSuccess(target.name());
        } catch (RuntimeException e) {
            metrics.recordSyncFailure(target.name(), e.getClass().getSimpleName());
            logger.error("❌ Failed to sync {} to {}: {}", transaction.id(), target.name(), e.getMessage());
        }
    }

    public List<SyncTarget> targets() {
        return targets;
    }

    public int pendingCount() {
        return executor.getQueue().size();
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Dropping {} unsent transactions on shutdown", executor.getQueue().size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
