package com.fxtrader.core.api;

import java.util.Optional;

/**
 * Failure of an exchange call, classified so callers can decide whether to retry.
 */
public class ApiException extends RuntimeException {

    public enum Kind {
        /** Network error, timeout, 5xx or an exchange-side error worth retrying. */
        TRANSIENT,
        /** Exchange throttling signal (ERR-5003). */
        RATE_LIMITED,
        /** Rejected credentials or signature. Not retried. */
        AUTH,
        /** Response could not be parsed or lacked a required field. Not retried. */
        MALFORMED
    }

    private final Kind kind;
    private final String messageCode;

    public ApiException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ApiException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public ApiException(Kind kind, String message, String messageCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.messageCode = messageCode;
    }

    public Kind kind() {
        return kind;
    }

    public Optional<String> messageCode() {
        return Optional.ofNullable(messageCode);
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT || kind == Kind.RATE_LIMITED;
    }

    /**
     * True when the request may have been applied by the exchange: a transport failure or
     * server error carrying no exchange message code.
     */
    public boolean outcomeUnknown() {
        return kind == Kind.TRANSIENT && messageCode == null;
    }

    /** Retry predicate for {@link com.fxtrader.core.retry.RetryPolicy#retryOn}. */
    public static boolean retryable(Throwable t) {
        return t instanceof ApiException api && api.isRetryable();
    }
}
