package com.fxtrader.core.notify;

/**
 * Outbound operator channel. Implementations must not block trading loops for long and must
 * not throw on delivery failure.
 */
public interface Notifier {

    void send(String message);

    /**
     * @return true when the channel is reachable
     */
    boolean ping();
}
