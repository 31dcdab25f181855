package com.fxtrader.core.retry;

import com.fxtrader.core.time.Sleeper;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Bounded retry with a pluggable backoff schedule.
 *
 * One instance describes one kind of retry (API transport, entry attempts, exit attempts,
 * fill lookup...). Instances are immutable and thread-safe; the waiting between attempts goes
 * through the injected {@link Sleeper}.
 *
 * Usage:
 *   var policy = RetryPolicy.fixed("exit order", 3, Duration.ofSeconds(10), sleeper);
 *   var result = policy.execute(() -> executor.closeOnce(position));
 */
public final class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private static final Duration BACKOFF_BASE = Duration.ofSeconds(1);
    private static final Duration BACKOFF_CAP = Duration.ofSeconds(60);
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final double BACKOFF_RANDOMIZATION = 0.5;

    private final String name;
    private final int maxAttempts;
    private final IntervalFunction intervals;
    private final Predicate<Throwable> retryOn;
    private final Sleeper sleeper;

    private RetryPolicy(String name, int maxAttempts, IntervalFunction intervals,
                        Predicate<Throwable> retryOn, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.intervals = intervals;
        this.retryOn = retryOn;
        this.sleeper = sleeper;
    }

    /**
     * Exponential random backoff: 1s base, doubling, +/-50% jitter, capped at 60s.
     */
    public static RetryPolicy exponential(String name, int maxAttempts, Sleeper sleeper) {
        var intervals = IntervalFunction.ofExponentialRandomBackoff(
            BACKOFF_BASE, BACKOFF_MULTIPLIER, BACKOFF_RANDOMIZATION, BACKOFF_CAP);
        return new RetryPolicy(name, maxAttempts, intervals, e -> true, sleeper);
    }

    /**
     * Same wait between every attempt.
     */
    public static RetryPolicy fixed(String name, int maxAttempts, Duration interval, Sleeper sleeper) {
        return new RetryPolicy(name, maxAttempts, IntervalFunction.of(interval), e -> true, sleeper);
    }

    /**
     * Copy of this policy that only retries failures matching {@code predicate};
     * anything else propagates on the first occurrence.
     */
    public RetryPolicy retryOn(Predicate<Throwable> predicate) {
        return new RetryPolicy(name, maxAttempts, intervals, predicate, sleeper);
    }

    public String name() {
        return name;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Run {@code operation} until it returns normally or attempts run out.
     *
     * @throws RetryExhaustedException when every attempt failed with a retryable error
     * @throws InterruptedException    when the wait between attempts is interrupted
     */
    public <T> T execute(Callable<T> operation) throws InterruptedException {
        Throwable lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                T result = operation.call();
                if (attempt > 1) {
                    logger.info("✅ {} succeeded on attempt {}/{}", name, attempt, maxAttempts);
                }
                return result;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (!retryOn.test(e)) {
                    throw propagate(e);
                }
                lastFailure = e;
                waitBeforeNextAttempt(attempt, e.getMessage());
            }
        }
        logger.error("❌ {} failed after {} attempts", name, maxAttempts);
        throw new RetryExhaustedException(name, maxAttempts, lastFailure);
    }

    /**
     * Poll until {@code lookup} yields a value. Retryable failures count as empty polls.
     * Returns empty once attempts run out instead of throwing.
     */
    public <T> Optional<T> poll(Callable<Optional<T>> lookup) throws InterruptedException {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String outcome;
            try {
                Optional<T> found = lookup.call();
                if (found.isPresent()) {
                    return found;
                }
                outcome = "nothing yet";
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (!retryOn.test(e)) {
                    throw propagate(e);
                }
                outcome = e.getMessage();
            }
            waitBeforeNextAttempt(attempt, outcome);
        }
        logger.warn("⚠️ {} found nothing after {} attempts", name, maxAttempts);
        return Optional.empty();
    }

    private void waitBeforeNextAttempt(int attempt, String reason) throws InterruptedException {
        if (attempt >= maxAttempts) {
            return;
        }
        long delayMs = intervals.apply(attempt);
        logger.warn("⚠️ {} failed (attempt {}/{}): {} - Retrying in {}ms",
            name, attempt, maxAttempts, reason, delayMs);
        sleeper.sleep(Duration.ofMillis(delayMs));
    }

    private RuntimeException propagate(Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return new RetryExhaustedException(name, 1, e);
    }
}
