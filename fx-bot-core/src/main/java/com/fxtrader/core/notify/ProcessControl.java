package com.fxtrader.core.notify;

/**
 * Process-level actions the supervisor may take once positions are flat.
 */
public interface ProcessControl {

    /** Replace the running process with a fresh one. */
    void restart();

    /** Stop for good; an operator has to start the bot again. */
    void halt(String reason);
}
