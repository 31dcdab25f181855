package com.fxtrader.core.model;

import java.time.LocalTime;
import java.util.OptionalLong;

/**
 * One validated row of the daily trade plan.
 *
 * @param row      1-based row number in the source, for messages
 * @param rawSide  the side as written in the plan, echoed in notifications
 * @param lotSize  fixed order size, or empty to size automatically
 */
public record TradePlanEntry(
    int row,
    String symbol,
    Side side,
    String rawSide,
    LocalTime entryTime,
    LocalTime exitTime,
    OptionalLong lotSize
) {

    public String lotLabel() {
        return lotSize.isPresent() ? String.valueOf(lotSize.getAsLong()) : "auto";
    }
}
