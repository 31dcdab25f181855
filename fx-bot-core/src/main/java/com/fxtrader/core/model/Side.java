package com.fxtrader.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Order direction as the exchange spells it.
 */
public enum Side {
    BUY,
    SELL;

    /**
     * The side of the order that settles a position opened on this side.
     */
    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Parse a side from a trade plan cell.
     * Accepts the exchange names plus the 買/売, long/short and l/s aliases, case-insensitive.
     */
    public static Optional<Side> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "buy", "買", "long", "l" -> Optional.of(BUY);
            case "sell", "売", "short", "s" -> Optional.of(SELL);
            default -> Optional.empty();
        };
    }
}
