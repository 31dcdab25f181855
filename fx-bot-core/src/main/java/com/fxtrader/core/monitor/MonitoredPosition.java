package com.fxtrader.core.monitor;

import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.Side;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * An open position the engine is responsible for closing.
 *
 * @param planRow   plan row that opened it, 0 when it was found outside the plan
 * @param entryTime local time the position was opened or adopted
 * @param exitAt    scheduled exit, null when the position has no plan entry
 */
public record MonitoredPosition(Position position, int planRow, LocalDateTime entryTime, LocalDateTime exitAt) {

    public static MonitoredPosition unplanned(Position position, LocalDateTime entryTime) {
        return new MonitoredPosition(position, 0, entryTime, null);
    }

    public long positionId() {
        return position.positionId();
    }

    public String symbol() {
        return position.symbol();
    }

    public Side side() {
        return position.side();
    }

    public long size() {
        return position.size();
    }

    public double entryPrice() {
        return position.entryPrice();
    }

    public Optional<LocalDateTime> scheduledExit() {
        return Optional.ofNullable(exitAt);
    }
}
