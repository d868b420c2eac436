package com.simtrade.core.api;

import com.simtrade.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateGovernor Tests")
class RateGovernorTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
    }

    @Test
    @DisplayName("N+1 calls inside one window yield exactly one denial")
    void testBudgetExhaustion() {
        var governor = new RateGovernor(new RateGovernor.Limits(5, Duration.ZERO), Map.of(), clock);

        int granted = 0;
        int denied = 0;
        for (int i = 0; i < 6; i++) {
            if (governor.tryAcquire("coingecko")) {
                granted++;
            } else {
                denied++;
            }
        }

        assertEquals(5, granted);
        assertEquals(1, denied);
    }

    @Test
    @DisplayName("Should enforce minimum spacing between calls")
    void testMinimumSpacing() {
        var governor = new RateGovernor(new RateGovernor.Limits(10, Duration.ofMillis(2000)), Map.of(), clock);

        assertTrue(governor.tryAcquire("kraken"));
        clock.advanceMillis(1999);
        assertFalse(governor.tryAcquire("kraken"), "1999ms after the last call is too soon");
        clock.advanceMillis(1);
        assertTrue(governor.tryAcquire("kraken"), "Exactly the minimum spacing is allowed");
    }

    @Test
    @DisplayName("Window reset restores budget without banking unused calls")
    void testWindowReset() {
        var governor = new RateGovernor(new RateGovernor.Limits(2, Duration.ZERO), Map.of(), clock);

        assertTrue(governor.tryAcquire("coingecko"));
        assertTrue(governor.tryAcquire("coingecko"));
        assertFalse(governor.tryAcquire("coingecko"));

        governor.resetWindows();
        governor.resetWindows();

        assertTrue(governor.tryAcquire("coingecko"));
        assertTrue(governor.tryAcquire("coingecko"));
        assertFalse(governor.tryAcquire("coingecko"), "Two resets must not bank four calls");
    }

    @Test
    @DisplayName("Providers have independent windows and overrides")
    void testPerProviderLimits() {
        var governor = new RateGovernor(new RateGovernor.Limits(1, Duration.ZERO),
            Map.of("kraken", new RateGovernor.Limits(3, Duration.ZERO)), clock);

        assertTrue(governor.tryAcquire("coingecko"));
        assertFalse(governor.tryAcquire("coingecko"));

        assertTrue(governor.tryAcquire("kraken"));
        assertTrue(governor.tryAcquire("kraken"));
        assertTrue(governor.tryAcquire("kraken"));
        assertFalse(governor.tryAcquire("kraken"));

        var snapshot = governor.snapshot("kraken").orElseThrow();
        assertEquals(3, snapshot.callsInWindow());
        assertEquals(1, snapshot.denials());
        assertTrue(governor.snapshot("alphavantage").isEmpty());
    }

    @Test
    @DisplayName("Concurrent callers never exceed the budget")
    void testConcurrentAcquire() throws Exception {
        var governor = new RateGovernor(new RateGovernor.Limits(5, Duration.ZERO), Map.of(), clock);
        var pool = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<Boolean>>();

        try {
            for (int i = 0; i < 50; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return governor.tryAcquire("coingecko");
                }));
            }
            start.countDown();

            int granted = 0;
            for (var future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertEquals(5, granted);
        } finally {
            pool.shutdownNow();
        }
    }
}
