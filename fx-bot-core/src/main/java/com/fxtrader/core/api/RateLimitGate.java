package com.fxtrader.core.api;

import com.fxtrader.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * Adaptive per-method request pacing shared by every caller of the exchange client.
 *
 * Each HTTP method keeps its own last-request instant; a caller waits until
 * {@code 1/currentLimit} seconds have passed since the previous request of the same method,
 * plus a small random jitter. Throttle signals cut the limit after a streak, clean calls
 * walk it back up one request/second at a time.
 *
 * The limit always stays within {@code [floor, ceiling]}.
 */
public class RateLimitGate {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitGate.class);

    public static final int DEFAULT_CEILING = 20;
    public static final int DEFAULT_FLOOR = 5;
    public static final int DECREASE_STEP = 5;
    public static final int THROTTLE_THRESHOLD = 3;

    private static final double POST_JITTER_SECONDS = 0.1;
    private static final double GET_JITTER_SECONDS = 0.05;

    private final int ceiling;
    private final int floor;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier unitRandom;

    // Guards the limit and the streak; never held while sleeping
    private final ReentrantLock stateLock = new ReentrantLock();
    private int currentLimit;
    private int consecutiveThrottles;

    private final Map<String, ReentrantLock> methodLocks = new HashMap<>();
    private final Map<String, Instant> lastRequest = new HashMap<>();

    public RateLimitGate(Clock clock, Sleeper sleeper) {
        this(DEFAULT_CEILING, DEFAULT_FLOOR, clock, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RateLimitGate(int ceiling, int floor, Clock clock, Sleeper sleeper, DoubleSupplier unitRandom) {
        if (floor < 1 || ceiling < floor) {
            throw new IllegalArgumentException("Invalid rate bounds: floor=" + floor + ", ceiling=" + ceiling);
        }
        this.ceiling = ceiling;
        this.floor = floor;
        this.clock = clock;
        this.sleeper = sleeper;
        this.unitRandom = unitRandom;
        this.currentLimit = ceiling;
        logger.info("RateLimitGate initialized: ceiling={}/s, floor={}/s", ceiling, floor);
    }

    /**
     * Block until a request of {@code method} may be sent, then stamp it.
     * Callers of the same method are serialized; GET and POST pace independently.
     */
    public void acquire(String method) throws InterruptedException {
        ReentrantLock lock = methodLock(method);
        lock.lockInterruptibly();
        try {
            Instant last = lastStamp(method);
            if (last != null) {
                double interval = 1.0 / currentLimit();
                double elapsed = Duration.between(last, clock.instant()).toNanos() / 1e9;
                double jitter = unitRandom.getAsDouble() * ("POST".equals(method) ? POST_JITTER_SECONDS : GET_JITTER_SECONDS);
                double wait = interval - elapsed + jitter;
                if (wait > 0) {
                    sleeper.sleepSeconds(wait);
                }
            }
            stamp(method, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record an exchange throttle signal. Every {@value #THROTTLE_THRESHOLD}-long streak cuts the
     * limit by {@value #DECREASE_STEP}. The streak is capped at the threshold and is not cleared by
     * the cut, so recovery needs as many clean calls as the streak is long.
     */
    public void recordThrottle() {
        stateLock.lock();
        try {
            consecutiveThrottles = Math.min(consecutiveThrottles + 1, THROTTLE_THRESHOLD);
            if (consecutiveThrottles >= THROTTLE_THRESHOLD && currentLimit > floor) {
                int old = currentLimit;
                currentLimit = Math.max(floor, currentLimit - DECREASE_STEP);
                logger.warn("🐢 Rate limit reduced: {}/s -> {}/s after {} throttle responses",
                    old, currentLimit, consecutiveThrottles);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Record a throttle-free call. Drains the streak first; only once it is empty does the
     * limit climb back, one step per call.
     */
    public void recordSuccess() {
        stateLock.lock();
        try {
            if (consecutiveThrottles > 0) {
                consecutiveThrottles--;
            } else if (currentLimit < ceiling) {
                currentLimit++;
                logger.debug("Rate limit recovered to {}/s", currentLimit);
            }
        } finally {
            stateLock.unlock();
        }
    }

    public int currentLimit() {
        stateLock.lock();
        try {
            return currentLimit;
        } finally {
            stateLock.unlock();
        }
    }

    public int consecutiveThrottles() {
        stateLock.lock();
        try {
            return consecutiveThrottles;
        } finally {
            stateLock.unlock();
        }
    }

    public int ceiling() {
        return ceiling;
    }

    public int floor() {
        return floor;
    }

    private ReentrantLock methodLock(String method) {
        stateLock.lock();
        try {
            return methodLocks.computeIfAbsent(method, m -> new ReentrantLock());
        } finally {
            stateLock.unlock();
        }
    }

    private Instant lastStamp(String method) {
        stateLock.lock();
        try {
            return lastRequest.get(method);
        } finally {
            stateLock.unlock();
        }
    }

    private void stamp(String method, Instant at) {
        stateLock.lock();
        try {
            lastRequest.put(method, at);
        } finally {
            stateLock.unlock();
        }
    }
}
