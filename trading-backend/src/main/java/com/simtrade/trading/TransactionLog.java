package com.simtrade.trading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, in-order list of transactions. Entries are never removed;
 * the only change allowed is a status transition out of PENDING.
 */
public final class TransactionLog {
    private static final Logger logger = LoggerFactory.getLogger(TransactionLog.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Transaction> entries = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();

    public void append(Transaction transaction) {
        lock.lock();
        try {
            if (indexById.containsKey(transaction.id())) {
                throw new IllegalStateException("Duplicate transaction id " + transaction.id());
            }
            indexById.put(transaction.id(), entries.size());
            entries.add(transaction);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move a transaction to a new status.
     *
     * @throws IllegalStateException for unknown ids or illegal transitions
     */
    public Transaction transition(String id, TransactionStatus status, String reason) {
        lock.lock();
        try {
            Integer index = indexById.get(id);
            if (index == null) {
                throw new IllegalStateException("Unknown transaction " + id);
            }
            Transaction updated = entries.get(index).withStatus(status, reason);
            entries.set(index, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Transaction> find(String id) {
        lock.lock();
        try {
            Integer index = indexById.get(id);
            return index == null ? Optional.empty() : Optional.of(entries.get(index));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Most recent first.
     */
    public List<Transaction> recent(int limit) {
        lock.lock();
        try {
            var result = new ArrayList<Transaction>(Math.min(limit, entries.size()));
            for (int i = entries.size() - 1; i >= 0 && result.size() < limit; i--) {
                result.add(entries.get(i));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Oldest first.
     */
    public List<Transaction> all() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace contents with previously journaled transactions, oldest first.
     */
    public void restore(Collection<Transaction> saved) {
        lock.lock();
        try {
            entries.clear();
            indexById.clear();
            for (Transaction transaction : saved) {
                indexById.put(transaction.id(), entries.size());
                entries.add(transaction);
            }
            logger.info("Transaction log restored with {} entries", entries.size());
        } finally {
            lock.unlock();
        }
    }
}
