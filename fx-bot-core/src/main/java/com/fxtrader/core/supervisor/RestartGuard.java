package com.fxtrader.core.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds automatic restarts: at most {@code maxRestarts} per process lifetime, at least
 * {@code cooldown} apart. Refused attempts are not counted.
 */
public class RestartGuard {
    private static final Logger logger = LoggerFactory.getLogger(RestartGuard.class);

    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_RESTARTS = 5;

    public enum Decision {
        ALLOWED,
        COOLDOWN,
        EXHAUSTED
    }

    private final Clock clock;
    private final Duration cooldown;
    private final int maxRestarts;
    private final ReentrantLock lock = new ReentrantLock();
    private int restarts;
    private Instant lastRestart;

    public RestartGuard(Clock clock) {
        this(clock, DEFAULT_COOLDOWN, DEFAULT_MAX_RESTARTS);
    }

    public RestartGuard(Clock clock, Duration cooldown, int maxRestarts) {
        this.clock = clock;
        this.cooldown = cooldown;
        this.maxRestarts = maxRestarts;
    }

    public Decision tryAcquire() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (restarts >= maxRestarts) {
                logger.error("🛑 Restart refused: {} of {} restarts used", restarts, maxRestarts);
                return Decision.EXHAUSTED;
            }
            if (lastRestart != null && Duration.between(lastRestart, now).compareTo(cooldown) < 0) {
                logger.warn("⏳ Restart refused: last restart {}s ago, cooldown {}s",
                    Duration.between(lastRestart, now).toSeconds(), cooldown.toSeconds());
                return Decision.COOLDOWN;
            }
            restarts++;
            lastRestart = now;
            logger.warn("🔁 Restart {} of {} allowed", restarts, maxRestarts);
            return Decision.ALLOWED;
        } finally {
            lock.unlock();
        }
    }

    public int restarts() {
        lock.lock();
        try {
            return restarts;
        } finally {
            lock.unlock();
        }
    }

    public int maxRestarts() {
        return maxRestarts;
    }
}
