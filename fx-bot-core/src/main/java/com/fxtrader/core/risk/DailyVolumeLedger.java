package com.fxtrader.core.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-symbol executed volume for the current day, capped at a fixed limit.
 *
 * {@link #reserve} is the only way volume enters the ledger: the check and the increment
 * happen under one lock, so concurrent entries on the same symbol can never jointly pass the cap.
 */
public class DailyVolumeLedger {
    private static final Logger logger = LoggerFactory.getLogger(DailyVolumeLedger.class);

    private final long limit;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Long> volumes = new TreeMap<>();

    public DailyVolumeLedger(long limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Daily volume limit must be positive, got " + limit);
        }
        this.limit = limit;
    }

    /**
     * Atomically add {@code size} to the symbol's volume.
     *
     * @throws VolumeLimitExceededException if the new total would exceed the cap; nothing is recorded
     */
    public long reserve(String symbol, long size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Size must be positive, got " + size);
        }
        lock.lock();
        try {
            long current = volumes.getOrDefault(symbol, 0L);
            if (current + size > limit) {
                logger.warn("🚫 {} daily volume cap reached: {} + {} > {}", symbol, current, size, limit);
                throw new VolumeLimitExceededException(symbol, size, current, limit);
            }
            long total = current + size;
            volumes.put(symbol, total);
            logger.debug("{} daily volume now {} / {}", symbol, total, limit);
            return total;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Give back a reservation whose order was never filled.
     */
    public void release(String symbol, long size) {
        lock.lock();
        try {
            long remaining = Math.max(0, volumes.getOrDefault(symbol, 0L) - size);
            if (remaining == 0) {
                volumes.remove(symbol);
            } else {
                volumes.put(symbol, remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    public long volumeFor(String symbol) {
        lock.lock();
        try {
            return volumes.getOrDefault(symbol, 0L);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Long> snapshot() {
        lock.lock();
        try {
            return Map.copyOf(volumes);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            logger.info("🔄 Daily volume ledger reset ({} symbols cleared)", volumes.size());
            volumes.clear();
        } finally {
            lock.unlock();
        }
    }

    public long limit() {
        return limit;
    }
}
