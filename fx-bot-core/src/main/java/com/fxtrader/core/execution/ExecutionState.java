package com.fxtrader.core.execution;

/**
 * Lifecycle of one plan entry inside {@link OrderExecutor}.
 */
public enum ExecutionState {
    IDLE,
    SPREAD_CHECK,
    PLACING,
    RESOLVING_POSITION,
    MONITORING,
    CLOSING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
