package com.simtrade.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Storage behind one cache tier. Tiers store and return entries as written;
 * expiry is decided by {@link TieredQuoteCache}.
 *
 * Slower tiers may throw {@link QuoteCacheException} on I/O failure.
 */
public interface QuoteCacheTier extends AutoCloseable {

    CacheTier tier();

    Duration ttl();

    Optional<CacheEntry> get(String symbol);

    void put(String symbol, CacheEntry entry);

    void remove(String symbol);

    /**
     * Remove the entry only if the one currently stored is expired at {@code now},
     * so a fresh entry written concurrently survives.
     */
    boolean removeIfExpired(String symbol, long now);

    void clear();

    int size();

    /**
     * Drop every entry expired at {@code now}. Returns the number removed.
     */
    int purgeExpired(long now);

    @Override
    default void close() {
    }
}
