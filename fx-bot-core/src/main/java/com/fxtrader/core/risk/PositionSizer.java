package com.fxtrader.core.risk;

import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.model.Quote;
import com.fxtrader.core.model.Side;
import com.fxtrader.core.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts account equity into an order volume.
 *
 * available = balance x riskRatio x 0.95; for pairs quoted in the account currency
 * volume = floor(available x leverage / rate). Other pairs convert {@code available} through the
 * quote currency's cross rate first. The result is clamped to [{@value #MIN_VOLUME}, {@value #MAX_VOLUME}].
 *
 * Quotes are always fetched fresh, never from the cache.
 */
public class PositionSizer {
    private static final Logger logger = LoggerFactory.getLogger(PositionSizer.class);

    public static final double SAFETY_MARGIN = 0.95;
    public static final long MIN_VOLUME = 1;
    public static final long MAX_VOLUME = 500_000;

    private final ExchangeGateway gateway;
    private final double riskRatio;

    public PositionSizer(ExchangeGateway gateway, double riskRatio) {
        if (riskRatio <= 0 || riskRatio > 1) {
            throw new IllegalArgumentException("riskRatio must be in (0, 1], got " + riskRatio);
        }
        this.gateway = gateway;
        this.riskRatio = riskRatio;
        logger.info("PositionSizer initialized: riskRatio={}, safetyMargin={}", riskRatio, SAFETY_MARGIN);
    }

    /**
     * @throws SizingException INVALID_INPUT for non-positive balance or leverage,
     *                         QUOTE_UNAVAILABLE when the symbol's rate cannot be fetched
     */
    public long size(double balance, String symbol, Side side, int leverage) throws InterruptedException {
        if (symbol == null || symbol.isBlank() || side == null) {
            throw new SizingException(SizingException.Reason.INVALID_INPUT, "Symbol and side are required");
        }
        if (!(balance > 0) || leverage <= 0) {
            throw new SizingException(SizingException.Reason.INVALID_INPUT,
                String.format("Balance and leverage must be positive (balance=%.2f, leverage=%d)", balance, leverage));
        }

        Quote quote = fetchQuote(symbol).orElseThrow(() -> new SizingException(
            SizingException.Reason.QUOTE_UNAVAILABLE, "No quote for " + symbol));
        double rate = quote.entryPrice(side);
        if (!(rate > 0)) {
            throw new SizingException(SizingException.Reason.QUOTE_UNAVAILABLE,
                String.format("Unusable %s rate for %s: %s", side, symbol, rate));
        }

        double available = balance * riskRatio * SAFETY_MARGIN;
        double raw;
        if (Symbols.isQuotedInAccountCurrency(symbol)) {
            raw = available * leverage / rate;
        } else {
            raw = crossConverted(available, symbol, leverage, rate);
        }

        long volume = clamp((long) Math.floor(raw));
        logger.info("📐 Sized {} {}: balance={}, available={}, rate={}, leverage={} -> {}",
            side, symbol, String.format("%.0f", balance), String.format("%.0f", available),
            Symbols.formatPrice(rate, symbol), leverage, volume);
        return volume;
    }

    private double crossConverted(double available, String symbol, int leverage, double rate)
            throws InterruptedException {
        String cross = Symbols.accountCrossSymbol(symbol);
        Optional<Quote> crossQuote;
        try {
            crossQuote = gateway.getQuote(cross);
        } catch (ApiException e) {
            logger.warn("⚠️ {} lookup failed: {}", cross, e.getMessage());
            crossQuote = Optional.empty();
        }
        if (crossQuote.isPresent() && crossQuote.get().bid() > 0) {
            double converted = available / crossQuote.get().bid();
            return converted * leverage / rate;
        }
        logger.warn("⚠️ {} rate unavailable, sizing {} without currency conversion", cross, symbol);
        return available * leverage / rate;
    }

    private Optional<Quote> fetchQuote(String symbol) throws InterruptedException {
        try {
            return gateway.getQuote(symbol);
        } catch (ApiException e) {
            throw new SizingException(SizingException.Reason.QUOTE_UNAVAILABLE,
                "Quote lookup for " + symbol + " failed: " + e.getMessage(), e);
        }
    }

    static long clamp(long volume) {
        return Math.max(MIN_VOLUME, Math.min(MAX_VOLUME, volume));
    }

    public double riskRatio() {
        return riskRatio;
    }
}
