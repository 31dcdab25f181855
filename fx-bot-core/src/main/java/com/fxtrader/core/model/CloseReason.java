package com.fxtrader.core.model;

/**
 * Which exit path closed a position.
 */
public enum CloseReason {
    SCHEDULED("scheduled exit"),
    STOP_LOSS("stop-loss"),
    TAKE_PROFIT("take-profit"),
    SWEEP("out-of-schedule sweep"),
    WATCHDOG("unrecognized position watchdog"),
    EMERGENCY("emergency close");

    private final String label;

    CloseReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isAutomatic() {
        return this != SCHEDULED;
    }
}
