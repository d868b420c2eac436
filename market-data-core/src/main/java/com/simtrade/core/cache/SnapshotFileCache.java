package com.simtrade.core.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mid tier: a JSON snapshot of recent quotes on local disk that survives restarts.
 *
 * Reads are served from an in-memory copy; every mutation rewrites the file
 * through a temp file so a crash never leaves a half-written snapshot.
 */
public final class SnapshotFileCache implements QuoteCacheTier {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotFileCache.class);
    private static final TypeReference<Map<String, CacheEntry>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final Path file;
    private final Duration ttl;
    private final ObjectMapper objectMapper;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public SnapshotFileCache(Path file, Duration ttl, ObjectMapper objectMapper) {
        this.file = file;
        this.ttl = ttl;
        this.objectMapper = objectMapper;
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            logger.debug("No quote snapshot at {}", file);
            return;
        }
        try {
            Map<String, CacheEntry> stored = objectMapper.readValue(file.toFile(), SNAPSHOT_TYPE);
            if (stored != null) {
                entries.putAll(stored);
            }
            logger.info("Loaded {} quotes from snapshot {}", entries.size(), file);
        } catch (IOException e) {
            // A corrupt snapshot only costs warm-up time
            logger.warn("Ignoring unreadable quote snapshot {}: {}", file, e.getMessage());
        }
    }

    @Override
    public CacheTier tier() {
        return CacheTier.SNAPSHOT;
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
        writeLock.lock();
        try {
            entries.put(symbol, entry);
            flush();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void remove(String symbol) {
        writeLock.lock();
        try {
            if (entries.remove(symbol) != null) {
                flush();
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean removeIfExpired(String symbol, long now) {
        writeLock.lock();
        try {
            CacheEntry current = entries.get(symbol);
            if (current == null || !current.isExpired(now)) {
                return false;
            }
            entries.remove(symbol);
            flush();
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            entries.clear();
            flush();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int purgeExpired(long now) {
        writeLock.lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.isExpired(now));
            int removed = before - entries.size();
            if (removed > 0) {
                flush();
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    private void flush() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), new HashMap<>(entries));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new QuoteCacheException("Quote snapshot write failed: " + file, e);
        }
    }
}
