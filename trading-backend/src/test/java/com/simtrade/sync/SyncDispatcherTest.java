package com.simtrade.sync;

import com.simtrade.metrics.MetricsService;
import com.simtrade.trading.Transaction;
import com.simtrade.trading.TransactionStatus;
import com.simtrade.trading.TransactionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SyncDispatcher Tests")
class SyncDispatcherTest {

    private static final Transaction TX = new Transaction("tx_1", "AAPL", TransactionType.BUY, 2, 300.0, 600.0, 1.0,
        Instant.EPOCH, TransactionStatus.COMPLETED, 1000.0, 399.0, null, null);

    @Mock
    private TransactionSync sync;

    @Mock
    private AuditRecorder audit;

    private SimpleMeterRegistry registry;
    private MetricsService metrics;
    private SyncDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricsService(registry);
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Test
    @DisplayName("Delivers to every target")
    void testDeliversToAllTargets() {
        dispatcher = new SyncDispatcher(List.of(SyncTarget.backend(sync), SyncTarget.audit(audit)),
            10, 3, Duration.ofMillis(10), metrics);

        assertThat(dispatcher.dispatch(TX)).isTrue();

        verify(sync, timeout(2000)).persist(TX);
        verify(audit, timeout(2000)).record(TX);
    }

    @Test
    @DisplayName("Transient failures are retried")
    void testRetry() {
        doThrow(new SyncException("HTTP 503", 503, null))
            .doNothing()
            .when(sync).persist(any());
        dispatcher = new SyncDispatcher(List.of(SyncTarget.backend(sync)), 10, 3, Duration.ofMillis(10), metrics);

        dispatcher.dispatch(TX);

        verify(sync, timeout(2000).times(2)).persist(TX);
        await(() -> registry.counter("trading.sync.success", "target", "backend").count() == 1.0);
    }

    @Test
    @DisplayName("Exhausted retries are counted, not thrown")
    void testFailureCounted() {
        doThrow(new SyncException("down", null)).when(sync).persist(any());
        dispatcher = new SyncDispatcher(List.of(SyncTarget.backend(sync)), 10, 3, Duration.ofMillis(10), metrics);

        assertThat(dispatcher.dispatch(TX)).isTrue();

        verify(sync, timeout(2000).times(3)).persist(TX);
        await(() -> registry.counter("trading.sync.failures", "target", "backend", "reason", "SyncException").count() == 1.0);
    }

    @Test
    @DisplayName("A full queue rejects immediately")
    void testQueueFull() throws Exception {
        var started = new CountDownLatch(2);
        var release = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(sync).persist(any());
        dispatcher = new SyncDispatcher(List.of(SyncTarget.backend(sync)), 1, 1, Duration.ofMillis(10), metrics);

        // Occupy the core thread, fill the single queue slot, then occupy the second thread
        assertThat(dispatcher.dispatch(TX)).isTrue();
        assertThat(dispatcher.dispatch(TX)).isTrue();
        assertThat(dispatcher.dispatch(TX)).isTrue();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(dispatcher.dispatch(TX)).isFalse();
        assertThat(registry.counter("trading.sync.failures", "target", "backend", "reason", "QueueFull").count())
            .isEqualTo(1.0);

        release.countDown();
    }

    @Test
    @DisplayName("No targets means nothing to do")
    void testNoTargets() {
        dispatcher = new SyncDispatcher(List.of(), 1, 1, Duration.ofMillis(10), metrics);
        assertThat(dispatcher.dispatch(TX)).isTrue();
    }

    private static void await(java.util.function.BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 2000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 2s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
