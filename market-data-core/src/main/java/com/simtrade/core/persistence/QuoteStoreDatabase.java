package com.simtrade.core.persistence;

import com.simtrade.core.cache.CacheEntry;
import com.simtrade.core.cache.CacheTier;
import com.simtrade.core.cache.QuoteCacheException;
import com.simtrade.core.cache.QuoteCacheTier;
import com.simtrade.core.model.Quote;
import com.simtrade.core.model.QuoteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite key-value store backing the long-lived quote tier.
 *
 * Thread-Safety: StampedLock with read locks for lookups and write locks for
 * mutations; the single JDBC connection is never used concurrently.
 */
public final class QuoteStoreDatabase implements QuoteCacheTier {
    private static final Logger logger = LoggerFactory.getLogger(QuoteStoreDatabase.class);

    private final Connection connection;
    private final StampedLock lock = new StampedLock();
    private final Duration ttl;

    public QuoteStoreDatabase(String dbPath) {
        this(dbPath, CacheTier.STORE.defaultTtl());
    }

    public QuoteStoreDatabase(String dbPath, Duration ttl) {
        this.ttl = ttl;
        String dbUrl = "jdbc:sqlite:" + dbPath;
        try {
            connection = DriverManager.getConnection(dbUrl);
            createTables();
            logger.info("Quote store initialized: {} (ttl {}m)", dbPath, ttl.toMinutes());
        } catch (SQLException e) {
            throw new QuoteCacheException("Failed to initialize quote store " + dbPath, e);
        }
    }

    private void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS quotes (
                symbol TEXT PRIMARY KEY,
                price REAL NOT NULL,
                open REAL,
                high REAL,
                low REAL,
                close REAL,
                volume REAL,
                change REAL,
                change_percent REAL,
                quote_time INTEGER NOT NULL,
                source TEXT NOT NULL,
                real_time INTEGER NOT NULL,
                cached_at INTEGER NOT NULL,
                ttl_ms INTEGER NOT NULL
            )
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public CacheTier tier() {
        return CacheTier.STORE;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public Optional<CacheEntry> get(String symbol) {
        String sql = "SELECT * FROM quotes WHERE symbol = ?";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(readEntry(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new QuoteCacheException("Quote store read failed for " + symbol, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public void put(String symbol, CacheEntry entry) {
        String sql = """
            INSERT OR REPLACE INTO quotes
                (symbol, price, open, high, low, close, volume, change, change_percent,
                 quote_time, source, real_time, cached_at, ttl_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        Quote quote = entry.quote();
        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            stmt.setDouble(2, quote.price());
            stmt.setDouble(3, quote.open());
            stmt.setDouble(4, quote.high());
            stmt.setDouble(5, quote.low());
            stmt.setDouble(6, quote.close());
            stmt.setDouble(7, quote.volume());
            stmt.setDouble(8, quote.change());
            stmt.setDouble(9, quote.changePercent());
            stmt.setLong(10, quote.timestamp());
            stmt.setString(11, quote.source().name());
            stmt.setInt(12, quote.realTime() ? 1 : 0);
            stmt.setLong(13, entry.cachedAt());
            stmt.setLong(14, entry.ttlMillis());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new QuoteCacheException("Quote store write failed for " + symbol, e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void remove(String symbol) {
        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement("DELETE FROM quotes WHERE symbol = ?")) {
            stmt.setString(1, symbol);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new QuoteCacheException("Quote store delete failed for " + symbol, e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public boolean removeIfExpired(String symbol, long now) {
        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement("DELETE FROM quotes WHERE symbol = ? AND ? - cached_at > ttl_ms")) {
            stmt.setString(1, symbol);
            stmt.setLong(2, now);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new QuoteCacheException("Quote store delete failed for " + symbol, e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void clear() {
        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            int deleted = stmt.executeUpdate("DELETE FROM quotes");
            logger.info("Quote store cleared ({} rows)", deleted);
        } catch (SQLException e) {
            throw new QuoteCacheException("Quote store clear failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public int size() {
        long stamp = lock.readLock();
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) FROM quotes")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new QuoteCacheException("Quote store count failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public int purgeExpired(long now) {
        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement("DELETE FROM quotes WHERE ? - cached_at > ttl_ms")) {
            stmt.setLong(1, now);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new QuoteCacheException("Quote store purge failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    private CacheEntry readEntry(ResultSet rs) throws SQLException {
        var quote = new Quote(
            rs.getString("symbol"),
            rs.getDouble("price"),
            rs.getDouble("open"),
            rs.getDouble("high"),
            rs.getDouble("low"),
            rs.getDouble("close"),
            rs.getDouble("volume"),
            rs.getDouble("change"),
            rs.getDouble("change_percent"),
            rs.getLong("quote_time"),
            QuoteSource.valueOf(rs.getString("source")),
            rs.getInt("real_time") == 1
        );
        return new CacheEntry(quote, rs.getLong("cached_at"), rs.getLong("ttl_ms"));
    }

    @Override
    public void close() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                logger.info("Quote store connection closed");
            }
        } catch (SQLException e) {
            logger.error("Error closing quote store", e);
        }
    }
}
