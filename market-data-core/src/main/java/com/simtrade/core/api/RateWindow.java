package com.simtrade.core.api;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Call accounting for one provider inside the current rate window.
 *
 * Check-and-record happens under one lock so two callers can never both
 * take the last permit.
 */
final class RateWindow {

    private final ReentrantLock lock = new ReentrantLock();

    private int callsInWindow;
    private long windowStart;
    private long lastCallAt;
    private boolean hasCalled;
    private long denials;

    RateWindow(long now) {
        this.windowStart = now;
    }

    boolean tryAcquire(long now, RateGovernor.Limits limits) {
        lock.lock();
        try {
            if (callsInWindow >= limits.callsPerWindow()) {
                denials++;
                return false;
            }
            if (hasCalled && now - lastCallAt < limits.minSpacing().toMillis()) {
                denials++;
                return false;
            }
            callsInWindow++;
            lastCallAt = now;
            hasCalled = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start a fresh window. Spacing still applies across the boundary.
     */
    void reset(long now) {
        lock.lock();
        try {
            callsInWindow = 0;
            windowStart = now;
        } finally {
            lock.unlock();
        }
    }

    RateGovernor.WindowSnapshot snapshot(String providerId) {
        lock.lock();
        try {
            return new RateGovernor.WindowSnapshot(providerId, callsInWindow, windowStart,
                hasCalled ? lastCallAt : -1L, denials);
        } finally {
            lock.unlock();
        }
    }
}
