package com.simtrade.persistence;

import com.simtrade.portfolio.Holding;
import com.simtrade.trading.Transaction;
import com.simtrade.trading.TransactionStatus;
import com.simtrade.trading.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite journal of completed transactions and the holdings they leave behind,
 * so a restarted session picks up where it stopped.
 *
 * Thread-Safety: StampedLock with write locks for mutations and read locks for queries.
 * Each trade is written in one database transaction.
 */
public final class TransactionJournal implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TransactionJournal.class);

    private final Connection connection;
    private final StampedLock lock = new StampedLock();

    public TransactionJournal(String dbPath) {
        String dbUrl = "jdbc:sqlite:" + dbPath;
        try {
            connection = DriverManager.getConnection(dbUrl);
            createTables();
            logger.info("Transaction journal initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize transaction journal", e);
        }
    }

    private void createTables() throws SQLException {
        String transactionsSql = """
            CREATE TABLE IF NOT EXISTS transactions (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                id TEXT NOT NULL UNIQUE,
                symbol TEXT NOT NULL,
                type TEXT NOT NULL,
                quantity INTEGER NOT NULL,
                price REAL NOT NULL,
                total_amount REAL NOT NULL,
                fee REAL NOT NULL,
                timestamp TEXT NOT NULL,
                status TEXT NOT NULL,
                balance_before REAL NOT NULL,
                balance_after REAL NOT NULL,
                realized_gain_loss REAL,
                failure_reason TEXT
            )
            """;

        String holdingsSql = """
            CREATE TABLE IF NOT EXISTS holdings (
                symbol TEXT PRIMARY KEY,
                quantity INTEGER NOT NULL,
                average_price REAL NOT NULL,
                total_cost REAL NOT NULL,
                last_trade_price REAL NOT NULL,
                last_trade_date TEXT NOT NULL
            )
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(transactionsSql);
            stmt.execute(holdingsSql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_tx_symbol ON transactions(symbol)");
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Record a transaction together with the resulting holding in one database transaction.
     *
     * @param holdingAfter the holding after the trade, or empty if it was closed out
     */
    public void recordTrade(Transaction transaction, Optional<Holding> holdingAfter) {
        String insertSql = """
            INSERT INTO transactions (id, symbol, type, quantity, price, total_amount, fee, timestamp,
                                      status, balance_before, balance_after, realized_gain_loss, failure_reason)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        String upsertSql = """
            INSERT OR REPLACE INTO holdings (symbol, quantity, average_price, total_cost, last_trade_price, last_trade_date)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try {
            connection.setAutoCommit(false);
            try (var insert = connection.prepareStatement(insertSql)) {
                insert.setString(1, transaction.id());
                insert.setString(2, transaction.symbol());
                insert.setString(3, transaction.type().name());
                insert.setInt(4, transaction.quantity());
                insert.setDouble(5, transaction.price());
                insert.setDouble(6, transaction.totalAmount());
                insert.setDouble(7, transaction.fee());
                insert.setString(8, transaction.timestamp().toString());
                insert.setString(9, transaction.status().name());
                insert.setDouble(10, transaction.balanceBefore());
                insert.setDouble(11, transaction.balanceAfter());
                if (transaction.realizedGainLoss() != null) {
                    insert.setDouble(12, transaction.realizedGainLoss());
                } else {
                    insert.setNull(12, Types.REAL);
                }
                insert.setString(13, transaction.failureReason());
                insert.executeUpdate();
            }

            if (holdingAfter.isPresent()) {
                var holding = holdingAfter.get();
                try (var upsert = connection.prepareStatement(upsertSql)) {
                    upsert.setString(1, holding.symbol());
                    upsert.setInt(2, holding.quantity());
                    upsert.setDouble(3, holding.averagePrice());
                    upsert.setDouble(4, holding.totalCost());
                    upsert.setDouble(5, holding.lastTradePrice());
                    upsert.setString(6, holding.lastTradeDate().toString());
                    upsert.executeUpdate();
                }
            } else {
                try (var delete = connection.prepareStatement("DELETE FROM holdings WHERE symbol = ?")) {
                    delete.setString(1, transaction.symbol());
                    delete.executeUpdate();
                }
            }

            connection.commit();

            logger.atInfo()
                .addKeyValue("id", transaction.id())
                .addKeyValue("symbol", transaction.symbol())
                .addKeyValue("type", transaction.type())
                .addKeyValue("quantity", transaction.quantity())
                .addKeyValue("price", transaction.price())
                .log("Transaction journaled");

        } catch (SQLException e) {
            rollbackQuietly();
            logger.error("Failed to journal transaction {}", transaction.id(), e);
            throw new RuntimeException("Journal write failed", e);
        } finally {
            restoreAutoCommit();
            lock.unlockWrite(stamp);
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            logger.warn("Journal rollback failed: {}", e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            logger.warn("Failed to restore auto-commit: {}", e.getMessage());
        }
    }

    public List<Holding> loadHoldings() {
        String sql = "SELECT * FROM holdings ORDER BY symbol";
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql);
             var rs = stmt.executeQuery()) {
            var holdings = new ArrayList<Holding>();
            while (rs.next()) {
                holdings.add(new Holding(
                    rs.getString("symbol"),
                    rs.getInt("quantity"),
                    rs.getDouble("average_price"),
                    rs.getDouble("total_cost"),
                    rs.getDouble("last_trade_price"),
                    Instant.parse(rs.getString("last_trade_date"))));
            }
            return holdings;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load holdings", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * All journaled transactions, oldest first.
     */
    public List<Transaction> loadTransactions() {
        String sql = "SELECT * FROM transactions ORDER BY seq";
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql);
             var rs = stmt.executeQuery()) {
            var transactions = new ArrayList<Transaction>();
            while (rs.next()) {
                transactions.add(mapTransaction(rs));
            }
            return transactions;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load transactions", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private static Transaction mapTransaction(ResultSet rs) throws SQLException {
        double realized = rs.getDouble("realized_gain_loss");
        Double realizedGainLoss = rs.wasNull() ? null : realized;
        return new Transaction(
            rs.getString("id"),
            rs.getString("symbol"),
            TransactionType.valueOf(rs.getString("type")),
            rs.getInt("quantity"),
            rs.getDouble("price"),
            rs.getDouble("total_amount"),
            rs.getDouble("fee"),
            Instant.parse(rs.getString("timestamp")),
            TransactionStatus.valueOf(rs.getString("status")),
            rs.getDouble("balance_before"),
            rs.getDouble("balance_after"),
            realizedGainLoss,
            rs.getString("failure_reason"));
    }

    /**
     * Cash balance after the most recent completed transaction, if any.
     */
    public OptionalDouble lastBalance() {
        String sql = "SELECT balance_after FROM transactions WHERE status = 'COMPLETED' ORDER BY seq DESC LIMIT 1";
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql);
             var rs = stmt.executeQuery()) {
            return rs.next() ? OptionalDouble.of(rs.getDouble(1)) : OptionalDouble.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read last balance", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public int countTransactions() {
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement("SELECT COUNT(*) FROM transactions");
             var rs = stmt.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count transactions", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Delete everything. Used to reset a session.
     */
    public void clear() {
        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute("DELETE FROM transactions");
            stmt.execute("DELETE FROM holdings");
            logger.info("🗑️ Transaction journal cleared");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear journal", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void close() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                logger.info("Transaction journal closed");
            }
        } catch (SQLException e) {
            logger.error("Error closing transaction journal", e);
        }
    }
}
