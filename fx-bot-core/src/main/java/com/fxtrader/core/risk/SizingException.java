package com.fxtrader.core.risk;

/**
 * Position sizing could not produce a volume.
 */
public class SizingException extends RuntimeException {

    public enum Reason {
        INVALID_INPUT,
        QUOTE_UNAVAILABLE
    }

    private final Reason reason;

    public SizingException(Reason reason, String message) {
        this(reason, message, null);
    }

    public SizingException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
