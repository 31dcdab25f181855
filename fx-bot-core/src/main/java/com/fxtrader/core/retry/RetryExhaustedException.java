package com.fxtrader.core.retry;

/**
 * Thrown when a {@link RetryPolicy} has used up its attempts. The cause is the last failure.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(String.format("%s failed after %d attempts", operation, attempts), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
