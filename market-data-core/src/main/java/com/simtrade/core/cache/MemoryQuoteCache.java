package com.simtrade.core.cache;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fastest tier: an in-process map, swept periodically for expired entries.
 */
public final class MemoryQuoteCache implements QuoteCacheTier {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;

    public MemoryQuoteCache() {
        this(CacheTier.MEMORY.defaultTtl());
    }

    public MemoryQuoteCache(Duration ttl) {
        this.ttl = ttl;
    }

    @Override
    public CacheTier tier() {
        return CacheTier.MEMORY;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public Optional<CacheEntry> get(String symbol) {
        return Optional.ofNullable(entries.get(symbol));
    }

    @Override
    public void put(String symbol, CacheEntry entry) {
        entries.put(symbol, entry);
    }

    @Override
    public void remove(String symbol) {
        entries.remove(symbol);
    }

    @Override
    public boolean removeIfExpired(String symbol, long now) {
        CacheEntry current = entries.get(symbol);
        return current != null && current.isExpired(now) && entries.remove(symbol, current);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int purgeExpired(long now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }
}
