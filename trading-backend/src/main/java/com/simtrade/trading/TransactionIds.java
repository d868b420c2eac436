package com.simtrade.trading;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unique, time-ordered transaction ids of the form {@code tx_<millis>_<sequence>}.
 * Ids sort lexicographically in creation order even if the wall clock steps back.
 */
public final class TransactionIds {

    private final Clock clock;
    private final AtomicLong lastMillis = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();

    public TransactionIds(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        long millis = lastMillis.accumulateAndGet(clock.millis(), Math::max);
        return String.format("tx_%013d_%06d", millis, sequence.incrementAndGet() % 1_000_000);
    }
}
