package com.fxtrader.core.model;

import java.time.Instant;

/**
 * Top of book for one symbol, valid until {@code expiresAt}.
 */
public record Quote(String symbol, double bid, double ask, Instant expiresAt) {

    public double spread() {
        return ask - bid;
    }

    public double spreadPips() {
        return spread() / Symbols.pipSize(symbol);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Price an order on this side fills at: ask to buy, bid to sell.
     */
    public double entryPrice(Side side) {
        return side == Side.BUY ? ask : bid;
    }

    /**
     * Price an open position on this side is marked at: bid for a long, ask for a short.
     */
    public double markPrice(Side side) {
        return side == Side.BUY ? bid : ask;
    }
}
