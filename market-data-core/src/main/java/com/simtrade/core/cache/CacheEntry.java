package com.simtrade.core.cache;

import com.simtrade.core.model.Quote;

/**
 * A cached quote with the time it was stored and how long it stays fresh.
 * Entries are replaced wholesale, never updated in place.
 */
public record CacheEntry(Quote quote, long cachedAt, long ttlMillis) {

    public boolean isExpired(long now) {
        return now - cachedAt > ttlMillis;
    }
}
