package com.fxtrader.core.time;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Blocking wait used by every loop that paces itself.
 * Injected so timing logic can be driven by a fake clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Parks the calling thread; honours interruption.
     */
    Sleeper SYSTEM = duration -> {
        long deadline = System.nanoTime() + duration.toNanos();
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            LockSupport.parkNanos(remaining);
            if (Thread.interrupted()) {
                throw new InterruptedException("sleep interrupted");
            }
        }
    };

    void sleep(Duration duration) throws InterruptedException;

    default void sleepSeconds(double seconds) throws InterruptedException {
        if (seconds > 0) {
            sleep(Duration.ofNanos((long) (seconds * TimeUnit.SECONDS.toNanos(1))));
        }
    }

    /**
     * Sleep until the clock reads {@code target}. Returns immediately when it is already past.
     */
    default void sleepUntil(Clock clock, LocalDateTime target) throws InterruptedException {
        Duration wait = Duration.between(LocalDateTime.now(clock), target);
        if (!wait.isNegative() && !wait.isZero()) {
            sleep(wait);
        }
    }
}
