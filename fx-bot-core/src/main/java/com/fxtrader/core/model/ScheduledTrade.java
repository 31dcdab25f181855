package com.fxtrader.core.model;

import java.time.LocalDateTime;

/**
 * A plan entry resolved to absolute local timestamps. {@code exitAt} is always after {@code entryAt}.
 */
public record ScheduledTrade(TradePlanEntry entry, LocalDateTime entryAt, LocalDateTime exitAt) {

    public ScheduledTrade {
        if (!exitAt.isAfter(entryAt)) {
            throw new IllegalArgumentException("exit " + exitAt + " must be after entry " + entryAt);
        }
    }

    public String symbol() {
        return entry.symbol();
    }

    public Side side() {
        return entry.side();
    }

    public int row() {
        return entry.row();
    }

    public boolean covers(LocalDateTime time) {
        return !time.isBefore(entryAt) && !time.isAfter(exitAt);
    }
}
