package com.fxtrader.core.api;

import com.fxtrader.core.model.AccountAssets;
import com.fxtrader.core.model.Execution;
import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.Quote;
import com.fxtrader.core.model.Side;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the engine needs from the exchange. Implementations pace, sign and retry
 * internally; failures surface as {@link ApiException}.
 */
public interface ExchangeGateway {

    AccountAssets getAssets() throws InterruptedException;

    /**
     * Fresh batched quote fetch, bypassing the cache.
     */
    Map<String, Quote> getQuotes(Collection<String> symbols) throws InterruptedException;

    /**
     * Quotes served from the short-TTL cache; missing or expired symbols are fetched in one batch.
     */
    Map<String, Quote> getCachedQuotes(Collection<String> symbols) throws InterruptedException;

    default Optional<Quote> getQuote(String symbol) throws InterruptedException {
        return Optional.ofNullable(getQuotes(List.of(symbol)).get(symbol));
    }

    /**
     * @return exchange order id
     */
    long placeMarketOrder(String symbol, Side side, long size) throws InterruptedException;

    /**
     * Market order settling {@code position} in full.
     *
     * @return exchange order id
     */
    long closePosition(Position position) throws InterruptedException;

    List<Execution> getExecutions(long orderId) throws InterruptedException;

    /**
     * @param symbol filter, or {@code null} for every symbol
     */
    List<Position> getOpenPositions(String symbol) throws InterruptedException;

    ApiStats stats();

    /**
     * Counters and rate-limit state for status and performance reports.
     */
    record ApiStats(long calls, long errors, int currentLimit, int throttleStreak) {
        public double successRate() {
            return calls == 0 ? 100.0 : (calls - errors) * 100.0 / calls;
        }
    }
}
