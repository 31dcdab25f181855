package com.fxtrader.core.execution;

/**
 * An entry attempt was refused before any order was sent (spread too wide, no quote).
 * The entry loop retries these.
 */
public class EntryRejectedException extends RuntimeException {

    public EntryRejectedException(String message) {
        super(message);
    }
}
