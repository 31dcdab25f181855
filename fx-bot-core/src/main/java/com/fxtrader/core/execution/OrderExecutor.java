package com.fxtrader.core.execution;

import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.config.Config;
import com.fxtrader.core.ledger.TradeLedger;
import com.fxtrader.core.model.CloseReason;
import com.fxtrader.core.model.Execution;
import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.Quote;
import com.fxtrader.core.model.ScheduledTrade;
import com.fxtrader.core.model.Side;
import com.fxtrader.core.model.Symbols;
import com.fxtrader.core.model.TradeResult;
import com.fxtrader.core.monitor.MonitoredPosition;
import com.fxtrader.core.monitor.PositionRegistry;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.core.retry.RetryExhaustedException;
import com.fxtrader.core.retry.RetryPolicy;
import com.fxtrader.core.risk.DailyVolumeLedger;
import com.fxtrader.core.risk.PositionSizer;
import com.fxtrader.core.risk.ProfitCalculator;
import com.fxtrader.core.risk.SizingException;
import com.fxtrader.core.risk.VolumeLimitExceededException;
import com.fxtrader.core.time.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry and exit of positions.
 *
 * Entry runs {@code SPREAD_CHECK -> PLACING -> RESOLVING_POSITION -> MONITORING} with up to
 * MAX_ENTRY_ORDER_ATTEMPTS spread-gated attempts. Each plan entry is single-flight: a second
 * {@link #enter} for the same scheduled trade is refused. An order whose outcome is unknown
 * (timeout, 5xx) is never sent again before the open positions show it did not land. Exit claims the position in the
 * {@link PositionRegistry} first, retries MAX_EXIT_ORDER_ATTEMPTS times and then makes one
 * last manual close attempt.
 */
public class OrderExecutor {
    private static final Logger logger = LoggerFactory.getLogger(OrderExecutor.class);

    /** Leverage used for plan rows without a lot when auto-lot is off. */
    public static final int FIXED_LEVERAGE = 18;

    private static final int EXECUTION_LOOKUP_ATTEMPTS = 3;
    private static final Duration EXECUTION_LOOKUP_INTERVAL = Duration.ofSeconds(1);
    private static final int POSITION_LOOKUP_ATTEMPTS = 5;
    private static final Duration POSITION_LOOKUP_INTERVAL = Duration.ofSeconds(3);

    private final Config config;
    private final ExchangeGateway gateway;
    private final PositionSizer sizer;
    private final ProfitCalculator profitCalculator;
    private final DailyVolumeLedger volumeLedger;
    private final TradeLedger tradeLedger;
    private final PositionRegistry registry;
    private final Notifier notifier;
    private final Clock clock;

    private final RetryPolicy entryPolicy;
    private final RetryPolicy exitPolicy;
    private final RetryPolicy executionLookup;
    private final RetryPolicy positionLookup;

    private final Map<String, ExecutionState> states = new ConcurrentHashMap<>();
    private final Map<Long, String> tradeKeysByPosition = new ConcurrentHashMap<>();
    private final Map<String, UnconfirmedOrder> unconfirmed = new ConcurrentHashMap<>();

    private final Counter ordersPlaced;
    private final Counter ordersFailed;
    private final Counter positionsClosed;
    private final DistributionSummary realizedProfit;

    public OrderExecutor(Config config, ExchangeGateway gateway, PositionSizer sizer,
                         ProfitCalculator profitCalculator, DailyVolumeLedger volumeLedger,
                         TradeLedger tradeLedger, PositionRegistry registry, Notifier notifier,
                         MeterRegistry meters, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.gateway = gateway;
        this.sizer = sizer;
        this.profitCalculator = profitCalculator;
        this.volumeLedger = volumeLedger;
        this.tradeLedger = tradeLedger;
        this.registry = registry;
        this.notifier = notifier;
        this.clock = clock;

        this.entryPolicy = RetryPolicy.fixed("entry order", config.maxEntryOrderAttempts(),
                config.entryOrderRetryInterval(), sleeper)
            .retryOn(e -> e instanceof EntryRejectedException || ApiException.retryable(e)
                || (e instanceof SizingException s && s.reason() == SizingException.Reason.QUOTE_UNAVAILABLE));
        this.exitPolicy = RetryPolicy.fixed("exit order", config.maxExitOrderAttempts(),
                config.exitOrderRetryInterval(), sleeper)
            .retryOn(ApiException::retryable);
        this.executionLookup = RetryPolicy.fixed("execution lookup", EXECUTION_LOOKUP_ATTEMPTS,
                EXECUTION_LOOKUP_INTERVAL, sleeper)
            .retryOn(ApiException::retryable);
        this.positionLookup = RetryPolicy.fixed("position lookup", POSITION_LOOKUP_ATTEMPTS,
                POSITION_LOOKUP_INTERVAL, sleeper)
            .retryOn(ApiException::retryable);

        this.ordersPlaced = Counter.builder("fx.orders.placed").description("Entry orders accepted").register(meters);
        this.ordersFailed = Counter.builder("fx.orders.failed").description("Entries or exits that gave up").register(meters);
        this.positionsClosed = Counter.builder("fx.positions.closed").description("Positions closed").register(meters);
        this.realizedProfit = DistributionSummary.builder("fx.trades.profit")
            .description("Realized profit per trade in account currency").register(meters);
    }

    // ==================== Entry ====================

    /**
     * Open the position for {@code trade}.
     *
     * @return the opened position, or empty if the entry failed or was already attempted
     */
    public Optional<MonitoredPosition> enter(ScheduledTrade trade) throws InterruptedException {
        String key = tradeKey(trade);
        if (states.putIfAbsent(key, ExecutionState.IDLE) != null) {
            logger.warn("⚠️ Entry for row {} at {} already attempted ({}), skipping", trade.row(), trade.entryAt(), states.get(key));
            return Optional.empty();
        }

        String label = describe(trade);
        logger.info("🎯 Entering {}", label);
        Placement placement;
        try {
            placement = entryPolicy.execute(() -> attemptEntry(key, trade));
        } catch (RetryExhaustedException e) {
            releaseUnconfirmed(key, trade.symbol());
            return failEntry(key, label, "all " + e.attempts() + " attempts failed: " + rootMessage(e));
        } catch (VolumeLimitExceededException e) {
            releaseUnconfirmed(key, trade.symbol());
            return failEntry(key, label, e.getMessage());
        } catch (ApiException | SizingException e) {
            releaseUnconfirmed(key, trade.symbol());
            return failEntry(key, label, e.getMessage());
        }

        transition(key, ExecutionState.RESOLVING_POSITION);
        ordersPlaced.increment();
        Optional<Position> position = placement.landed();
        if (position.isEmpty()) {
            Optional<Long> positionIdHint = recordFills(placement.orderId()).map(Execution::positionId).filter(id -> id > 0);
            position = resolvePosition(trade, positionIdHint);
        }
        if (position.isEmpty()) {
            return failEntry(key, label, "order " + placement.orderId() + " accepted but no open position could be found");
        }

        var monitored = new MonitoredPosition(position.get(), trade.row(), LocalDateTime.now(clock), trade.exitAt());
        tradeKeysByPosition.put(monitored.positionId(), key);
        transition(key, ExecutionState.MONITORING);
        notifier.send(String.format("✅ Entry filled: %s%n   Position %d @ %s, size %,d, spread %.1f pips",
            label, monitored.positionId(), Symbols.formatPrice(monitored.entryPrice(), trade.symbol()),
            monitored.size(), placement.spreadPips()));
        return Optional.of(monitored);
    }

    private Placement attemptEntry(String key, ScheduledTrade trade) throws InterruptedException {
        String symbol = trade.symbol();
        Optional<Placement> landed = confirmUnknownOrder(key, trade);
        if (landed.isPresent()) {
            return landed.get();
        }
        transition(key, ExecutionState.SPREAD_CHECK);
        Quote quote = gateway.getQuote(symbol)
            .orElseThrow(() -> rejectEntry(trade, "no quote for " + symbol));
        if (quote.spread() > config.spreadThreshold()) {
            throw rejectEntry(trade, String.format("spread %.1f pips (%s) above threshold %s",
                quote.spreadPips(), Symbols.formatPrice(quote.spread(), symbol), config.spreadThreshold()));
        }

        transition(key, ExecutionState.PLACING);
        long size = lotFor(trade);
        volumeLedger.reserve(symbol, size);
        try {
            long orderId = gateway.placeMarketOrder(symbol, trade.side(), size);
            return new Placement(orderId, size, quote.spreadPips(), Optional.empty());
        } catch (ApiException e) {
            if (e.outcomeUnknown()) {
                // Volume stays reserved until the next attempt has looked for the position.
                unconfirmed.put(key, new UnconfirmedOrder(size, quote.spreadPips()));
            } else {
                volumeLedger.release(symbol, size);
            }
            notifier.send(String.format("⚠️ Entry order failed for %s: %s", describe(trade), e.getMessage()));
            throw e;
        }
    }

    /**
     * After an order with an unknown outcome, look for the position it would have opened.
     * A lookup failure keeps the order unconfirmed and fails this attempt, so no second order
     * goes out while the first may be live.
     */
    private Optional<Placement> confirmUnknownOrder(String key, ScheduledTrade trade) throws InterruptedException {
        UnconfirmedOrder pending = unconfirmed.get(key);
        if (pending == null) {
            return Optional.empty();
        }
        transition(key, ExecutionState.RESOLVING_POSITION);
        Optional<Position> found = gateway.getOpenPositions(trade.symbol()).stream()
            .filter(p -> p.side() == trade.side())
            .filter(p -> !registry.isTracked(p.positionId()))
            .filter(p -> registry.claimOf(p.positionId()).isEmpty())
            .max(Comparator.comparing(Position::openTime, Comparator.nullsFirst(Comparator.naturalOrder())));
        unconfirmed.remove(key);
        if (found.isPresent()) {
            logger.warn("🧲 Order for {} landed despite the error: position {}", describe(trade), found.get().positionId());
            return Optional.of(new Placement(0, pending.size(), pending.spreadPips(), found));
        }
        logger.info("No position from the previous order for {}, placing again", describe(trade));
        volumeLedger.release(trade.symbol(), pending.size());
        return Optional.empty();
    }

    private void releaseUnconfirmed(String key, String symbol) {
        UnconfirmedOrder pending = unconfirmed.remove(key);
        if (pending != null) {
            volumeLedger.release(symbol, pending.size());
        }
    }

    private EntryRejectedException rejectEntry(ScheduledTrade trade, String reason) {
        logger.warn("⏸️ Entry for {} held back: {}", describe(trade), reason);
        notifier.send(String.format("⏸️ Entry held back for %s: %s", describe(trade), reason));
        return new EntryRejectedException(reason);
    }

    /**
     * Order size for a plan row: the fixed lot when given, otherwise sized from the account
     * at LEVERAGE (auto-lot) or at {@value #FIXED_LEVERAGE}.
     */
    long lotFor(ScheduledTrade trade) throws InterruptedException {
        var lot = trade.entry().lotSize();
        if (lot.isPresent()) {
            return lot.getAsLong();
        }
        int leverage = config.autoLot() ? config.leverage() : FIXED_LEVERAGE;
        double balance = gateway.getAssets().availableAmount();
        return sizer.size(balance, trade.symbol(), trade.side(), leverage);
    }

    /**
     * Dry-run sizing for the admin {@code testlot} command; no order is sent.
     */
    public long previewSize(String symbol, Side side) throws InterruptedException {
        int leverage = config.autoLot() ? config.leverage() : FIXED_LEVERAGE;
        double balance = gateway.getAssets().availableAmount();
        return sizer.size(balance, Symbols.normalize(symbol), side, leverage);
    }

    private Optional<MonitoredPosition> failEntry(String key, String label, String reason) {
        transition(key, ExecutionState.FAILED);
        ordersFailed.increment();
        logger.error("❌ Entry failed for {}: {}", label, reason);
        notifier.send(String.format("❌ Entry failed: %s%n   %s", label, reason));
        return Optional.empty();
    }

    /**
     * Look up the order's fills and book their fees. Non-fatal.
     *
     * @return the first fill, if any was found
     */
    private Optional<Execution> recordFills(long orderId) throws InterruptedException {
        try {
            Optional<List<Execution>> fills = executionLookup.poll(
                () -> Optional.of(gateway.getExecutions(orderId)).filter(list -> !list.isEmpty()));
            fills.ifPresent(list -> tradeLedger.addFee(list.stream().mapToDouble(Execution::fee).sum()));
            return fills.map(list -> list.get(0));
        } catch (ApiException e) {
            logger.warn("⚠️ Fill lookup for order {} failed: {}", orderId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Position> resolvePosition(ScheduledTrade trade, Optional<Long> positionIdHint)
            throws InterruptedException {
        try {
            return positionLookup.poll(() -> {
                var open = gateway.getOpenPositions(trade.symbol());
                if (positionIdHint.isPresent()) {
                    return open.stream().filter(p -> p.positionId() == positionIdHint.get()).findFirst();
                }
                return open.stream()
                    .filter(p -> p.side() == trade.side())
                    .filter(p -> !registry.isTracked(p.positionId()))
                    .max(Comparator.comparing(Position::openTime, Comparator.nullsFirst(Comparator.naturalOrder())));
            });
        } catch (ApiException e) {
            logger.error("❌ Position lookup for {} failed: {}", trade.symbol(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Last look for a position the exchange opened although every entry attempt failed.
     * A found position is taken over as if the entry had succeeded.
     */
    public Optional<MonitoredPosition> adopt(ScheduledTrade trade) throws InterruptedException {
        List<Position> open;
        try {
            open = gateway.getOpenPositions(trade.symbol());
        } catch (ApiException e) {
            logger.warn("⚠️ Final position check for {} failed: {}", trade.symbol(), e.getMessage());
            return Optional.empty();
        }
        var found = open.stream()
            .filter(p -> p.side() == trade.side())
            .filter(p -> !registry.isTracked(p.positionId()))
            .filter(p -> registry.claimOf(p.positionId()).isEmpty())
            .findFirst();
        found.ifPresent(p -> {
            String key = tradeKey(trade);
            tradeKeysByPosition.put(p.positionId(), key);
            transition(key, ExecutionState.MONITORING);
            logger.info("🧲 Adopted position {} for {}", p.positionId(), describe(trade));
            notifier.send(String.format("🧲 Found open position %d for %s after failed entry, monitoring it until %s",
                p.positionId(), describe(trade), trade.exitAt()));
        });
        return found.map(p -> new MonitoredPosition(p, trade.row(), LocalDateTime.now(clock), trade.exitAt()));
    }

    // ==================== Exit ====================

    /**
     * Close {@code position} through the single-claim exit path.
     *
     * @return the realized result; empty when another path owns the close or every attempt failed
     */
    public Optional<TradeResult> close(MonitoredPosition position, CloseReason reason) throws InterruptedException {
        if (!registry.tryClaim(position.positionId(), reason)) {
            return Optional.empty();
        }
        String key = tradeKeysByPosition.get(position.positionId());
        if (key != null) {
            transition(key, ExecutionState.CLOSING);
        }
        logger.info("🔚 Closing position {} ({} {}) for {}", position.positionId(),
            position.side(), position.symbol(), reason.label());

        Optional<Long> orderId = sendClose(position, reason);
        if (orderId.isEmpty()) {
            registry.releaseClaim(position.positionId());
            if (key != null) {
                transition(key, ExecutionState.FAILED);
            }
            ordersFailed.increment();
            return Optional.empty();
        }

        double exitPrice = exitPrice(orderId.get(), position);
        double pips = profitCalculator.pips(position.symbol(), position.side(), position.entryPrice(), exitPrice);
        double amount = profitCalculator.amount(position.symbol(), pips, position.size());
        var result = new TradeResult(position.symbol(), position.side(), position.entryPrice(), exitPrice,
            pips, amount, position.size(), position.entryTime(), LocalDateTime.now(clock), reason);

        tradeLedger.record(result);
        registry.unregister(position.positionId());
        tradeKeysByPosition.remove(position.positionId());
        if (key != null) {
            transition(key, ExecutionState.CLOSED);
        }
        positionsClosed.increment();
        realizedProfit.record(amount);

        notifier.send(String.format("%s Closed %s %s (%s)%n   %s -> %s, %+.1f pips, %+,.0f%s",
            pips > 0 ? "💰" : "📉", position.side(), position.symbol(), reason.label(),
            Symbols.formatPrice(position.entryPrice(), position.symbol()),
            Symbols.formatPrice(exitPrice, position.symbol()), pips, amount, balanceSuffix()));
        return Optional.of(result);
    }

    private Optional<Long> sendClose(MonitoredPosition position, CloseReason reason) throws InterruptedException {
        try {
            return Optional.of(exitPolicy.execute(() -> gateway.closePosition(position.position())));
        } catch (RetryExhaustedException | ApiException e) {
            logger.warn("⚠️ Close of position {} failed ({}), trying manual close", position.positionId(), rootMessage(e));
            notifier.send(String.format("⚠️ Close of position %d (%s) failed, trying manual close: %s",
                position.positionId(), reason.label(), rootMessage(e)));
        }
        try {
            long orderId = gateway.closePosition(position.position());
            logger.info("✅ Manual close of position {} accepted", position.positionId());
            return Optional.of(orderId);
        } catch (ApiException e) {
            logger.error("❌ Manual close of position {} failed", position.positionId(), e);
            notifier.send(String.format("🚨 Could not close position %d %s %s: %s. Manual action required.",
                position.positionId(), position.side(), position.symbol(), e.getMessage()));
            return Optional.empty();
        }
    }

    /**
     * Average fill price of the close order; falls back to the current mark price, then to the
     * entry price, when no fills can be read.
     */
    private double exitPrice(long orderId, MonitoredPosition position) throws InterruptedException {
        try {
            Optional<List<Execution>> fills = executionLookup.poll(
                () -> Optional.of(gateway.getExecutions(orderId)).filter(list -> !list.isEmpty()));
            if (fills.isPresent()) {
                tradeLedger.addFee(fills.get().stream().mapToDouble(Execution::fee).sum());
                return fills.get().stream().mapToDouble(Execution::price).average().orElseThrow();
            }
        } catch (ApiException e) {
            logger.warn("⚠️ Fill lookup for close order {} failed: {}", orderId, e.getMessage());
        }
        try {
            Optional<Quote> quote = gateway.getQuote(position.symbol());
            if (quote.isPresent()) {
                logger.warn("⚠️ No fills for close order {}, using mark price", orderId);
                return quote.get().markPrice(position.side());
            }
        } catch (ApiException e) {
            logger.warn("⚠️ Quote lookup for {} failed: {}", position.symbol(), e.getMessage());
        }
        logger.warn("⚠️ No exit price available for position {}, recording at entry price", position.positionId());
        return position.entryPrice();
    }

    private String balanceSuffix() throws InterruptedException {
        try {
            return String.format("%n   Balance: %,.0f", gateway.getAssets().balance());
        } catch (ApiException e) {
            logger.warn("⚠️ Balance lookup failed: {}", e.getMessage());
            return "";
        }
    }

    // ==================== State ====================

    public Optional<ExecutionState> stateOf(ScheduledTrade trade) {
        return Optional.ofNullable(states.get(tradeKey(trade)));
    }

    public Map<String, ExecutionState> states() {
        return Map.copyOf(states);
    }

    /**
     * Forget finished entries; open ones stay so they cannot be entered twice.
     */
    public void clearFinished() {
        states.values().removeIf(ExecutionState::isTerminal);
    }

    private void transition(String key, ExecutionState next) {
        ExecutionState previous = states.put(key, next);
        logger.debug("Trade {}: {} -> {}", key, previous, next);
    }

    private static String tradeKey(ScheduledTrade trade) {
        return trade.row() + "@" + trade.entryAt();
    }

    private static String describe(ScheduledTrade trade) {
        return String.format("#%d %s %s lot=%s (%s -> %s)", trade.row(), trade.entry().rawSide(), trade.symbol(),
            trade.entry().lotLabel(), trade.entryAt().toLocalTime(), trade.exitAt().toLocalTime());
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    private record Placement(long orderId, long size, double spreadPips, Optional<Position> landed) {}

    private record UnconfirmedOrder(long size, double spreadPips) {}
}
