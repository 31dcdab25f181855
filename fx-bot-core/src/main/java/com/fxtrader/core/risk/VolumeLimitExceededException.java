package com.fxtrader.core.risk;

/**
 * An order would push a symbol's daily volume past the cap. Raised before anything is sent.
 */
public class VolumeLimitExceededException extends RuntimeException {

    private final String symbol;
    private final long requested;
    private final long current;
    private final long limit;

    public VolumeLimitExceededException(String symbol, long requested, long current, long limit) {
        super(String.format("%s daily volume limit exceeded: %,d + %,d > %,d", symbol, current, requested, limit));
        this.symbol = symbol;
        this.requested = requested;
        this.current = current;
        this.limit = limit;
    }

    public String symbol() {
        return symbol;
    }

    public long requested() {
        return requested;
    }

    public long current() {
        return current;
    }

    public long limit() {
        return limit;
    }
}
