package com.fxtrader.core.ledger;

import com.fxtrader.core.model.TradeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only record of the trading day's closed positions and fees.
 *
 * Two views are kept: the day list, drained at finalize, and the recent history used by
 * performance reports, capped at {@value #DEFAULT_HISTORY_LIMIT} results by default. Both are
 * guarded by one lock.
 */
public class TradeLedger {
    private static final Logger logger = LoggerFactory.getLogger(TradeLedger.class);

    public static final int DEFAULT_HISTORY_LIMIT = 10_000;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<TradeResult> pending = new ArrayList<>();
    private final Deque<TradeResult> history = new ArrayDeque<>();
    private final int historyLimit;
    private LocalDateTime lastExit;
    private double feeTotal;

    public TradeLedger() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    public TradeLedger(int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be >= 1, got " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    public void record(TradeResult result) {
        lock.lock();
        try {
            pending.add(result);
            history.addLast(result);
            if (history.size() > historyLimit) {
                history.removeFirst();
            }
            if (lastExit == null || result.exitTime().isAfter(lastExit)) {
                lastExit = result.exitTime();
            }
            logger.debug("Recorded {} {} result: {} pips", result.side(), result.symbol(), result.profitPips());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return every pending result that exited before {@code cutoff}.
     * Later results stay for the next day's report.
     */
    public List<TradeResult> drainBefore(LocalDateTime cutoff) {
        lock.lock();
        try {
            var drained = new ArrayList<TradeResult>();
            var kept = new ArrayList<TradeResult>();
            for (TradeResult r : pending) {
                (r.exitTime().isBefore(cutoff) ? drained : kept).add(r);
            }
            pending.clear();
            pending.addAll(kept);
            drained.sort(Comparator.comparing(TradeResult::exitTime));
            if (!kept.isEmpty()) {
                logger.info("📎 {} result(s) after {} carried over to the next report", kept.size(), cutoff);
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public List<TradeResult> pending() {
        lock.lock();
        try {
            return List.copyOf(pending);
        } finally {
            lock.unlock();
        }
    }

    public List<TradeResult> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Latest exit ever recorded, including results already trimmed from the history.
     */
    public Optional<LocalDateTime> lastExitTime() {
        lock.lock();
        try {
            return Optional.ofNullable(lastExit);
        } finally {
            lock.unlock();
        }
    }

    public void addFee(double fee) {
        lock.lock();
        try {
            feeTotal += fee;
        } finally {
            lock.unlock();
        }
    }

    public double feeTotal() {
        lock.lock();
        try {
            return feeTotal;
        } finally {
            lock.unlock();
        }
    }

    public void resetFees() {
        lock.lock();
        try {
            feeTotal = 0;
        } finally {
            lock.unlock();
        }
    }
}
