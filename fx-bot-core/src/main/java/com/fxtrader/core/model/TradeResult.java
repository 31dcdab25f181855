package com.fxtrader.core.model;

import java.time.LocalDateTime;

/**
 * A closed position with its realized outcome.
 */
public record TradeResult(
    String symbol,
    Side side,
    double entryPrice,
    double exitPrice,
    double profitPips,
    double profitAmount,
    long lotSize,
    LocalDateTime entryTime,
    LocalDateTime exitTime,
    CloseReason reason
) {

    public boolean isWin() {
        return profitPips > 0;
    }
}
