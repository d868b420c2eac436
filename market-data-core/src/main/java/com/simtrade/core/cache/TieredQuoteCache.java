package com.simtrade.core.cache;

import com.simtrade.core.model.Quote;
import com.simtrade.core.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Multi-tier quote cache, consulted fastest tier first.
 *
 * Features:
 * - A hit in a slower tier is promoted into every faster tier
 * - Writes go to all tiers
 * - Expired entries are treated as misses and dropped on read
 * - Background sweep purges the memory tier
 *
 * Slower tiers are best effort: an I/O failure there is logged and
 * treated as a miss, never surfaced to the resolver.
 */
public final class TieredQuoteCache implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TieredQuoteCache.class);

    private final List<QuoteCacheTier> tiers;
    private final Clock clock;
    private final Map<CacheTier, AtomicLong> hits = new EnumMap<>(CacheTier.class);
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong tierErrors = new AtomicLong();
    private volatile ScheduledExecutorService sweeper;

    public TieredQuoteCache(List<QuoteCacheTier> tiers, Clock clock) {
        var ordered = new ArrayList<>(tiers);
        ordered.sort(Comparator.comparing(QuoteCacheTier::tier));
        this.tiers = List.copyOf(ordered);
        this.clock = clock;
        for (CacheTier tier : CacheTier.values()) {
            hits.put(tier, new AtomicLong());
        }
        logger.info("TieredQuoteCache initialized with tiers {}",
            this.tiers.stream().map(t -> t.tier() + "(" + t.ttl().toMinutes() + "m)").toList());
    }

    /**
     * Look a symbol up across all tiers.
     */
    public Optional<Quote> get(String symbol) {
        String key = Symbols.normalize(symbol);
        long now = clock.millis();

        for (int i = 0; i < tiers.size(); i++) {
            QuoteCacheTier tier = tiers.get(i);
            Optional<CacheEntry> entry = readFresh(tier, key, now);
            if (entry.isPresent()) {
                hits.get(tier.tier()).incrementAndGet();
                promote(key, entry.get().quote(), i, now);
                return Optional.of(entry.get().quote().asCached(tier.tier().source()));
            }
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    /**
     * Look a symbol up in a single tier, honouring that tier's expiry. No promotion.
     */
    public Optional<Quote> getFromTier(CacheTier cacheTier, String symbol) {
        String key = Symbols.normalize(symbol);
        long now = clock.millis();
        for (QuoteCacheTier tier : tiers) {
            if (tier.tier() == cacheTier) {
                return readFresh(tier, key, now)
                    .map(entry -> {
                        hits.get(cacheTier).incrementAndGet();
                        return entry.quote().asCached(cacheTier.source());
                    });
            }
        }
        return Optional.empty();
    }

    /**
     * Write a quote into every tier with that tier's lifetime.
     */
    public void put(String symbol, Quote quote) {
        String key = Symbols.normalize(symbol);
        long now = clock.millis();
        for (QuoteCacheTier tier : tiers) {
            write(tier, key, new CacheEntry(quote, now, tier.ttl().toMillis()));
        }
    }

    private Optional<CacheEntry> readFresh(QuoteCacheTier tier, String key, long now) {
        try {
            Optional<CacheEntry> entry = tier.get(key);
            if (entry.isPresent() && entry.get().isExpired(now)) {
                tier.removeIfExpired(key, now);
                return Optional.empty();
            }
            return entry;
        } catch (QuoteCacheException e) {
            tierErrors.incrementAndGet();
            logger.warn("{} tier read failed for {}: {}", tier.tier(), key, e.getMessage());
            return Optional.empty();
        }
    }

    private void promote(String key, Quote quote, int hitIndex, long now) {
        for (int i = 0; i < hitIndex; i++) {
            QuoteCacheTier faster = tiers.get(i);
            write(faster, key, new CacheEntry(quote, now, faster.ttl().toMillis()));
        }
    }

    private void write(QuoteCacheTier tier, String key, CacheEntry entry) {
        try {
            tier.put(key, entry);
        } catch (QuoteCacheException e) {
            tierErrors.incrementAndGet();
            logger.warn("{} tier write failed for {}: {}", tier.tier(), key, e.getMessage());
        }
    }

    public void clear() {
        for (QuoteCacheTier tier : tiers) {
            try {
                tier.clear();
            } catch (QuoteCacheException e) {
                tierErrors.incrementAndGet();
                logger.warn("{} tier clear failed: {}", tier.tier(), e.getMessage());
            }
        }
        logger.info("🗑️ Quote cache cleared");
    }

    /**
     * Purge expired entries from the memory tier.
     */
    public int sweepExpired() {
        long now = clock.millis();
        int removed = 0;
        for (QuoteCacheTier tier : tiers) {
            if (tier.tier() == CacheTier.MEMORY) {
                removed += tier.purgeExpired(now);
            }
        }
        if (removed > 0) {
            logger.debug("Swept {} expired quotes from memory", removed);
        }
        return removed;
    }

    public synchronized void startSweeper(Duration interval) {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "quote-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        sweeper.scheduleAtFixedRate(() -> {
            try {
                sweepExpired();
            } catch (RuntimeException e) {
                logger.warn("Cache sweep failed: {}", e.getMessage());
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public CacheStats stats() {
        var tierHits = new EnumMap<CacheTier, Long>(CacheTier.class);
        hits.forEach((tier, count) -> tierHits.put(tier, count.get()));
        var sizes = new EnumMap<CacheTier, Integer>(CacheTier.class);
        for (QuoteCacheTier tier : tiers) {
            try {
                sizes.put(tier.tier(), tier.size());
            } catch (QuoteCacheException e) {
                sizes.put(tier.tier(), -1);
            }
        }
        return new CacheStats(tierHits, sizes, misses.get(), tierErrors.get());
    }

    public List<CacheTier> tiers() {
        return tiers.stream().map(QuoteCacheTier::tier).toList();
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        for (QuoteCacheTier tier : tiers) {
            try {
                tier.close();
            } catch (Exception e) {
                logger.warn("Error closing {} tier: {}", tier.tier(), e.getMessage());
            }
        }
    }

    /**
     * Hit counts and sizes per tier. A size of -1 means the tier could not be read.
     */
    public record CacheStats(Map<CacheTier, Long> hits, Map<CacheTier, Integer> sizes, long misses, long tierErrors) {
    }
}
