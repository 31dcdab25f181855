package com.fxtrader.core.monitor;

import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.config.Config;
import com.fxtrader.core.execution.OrderExecutor;
import com.fxtrader.core.model.CloseReason;
import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.Quote;
import com.fxtrader.core.model.ScheduledTrade;
import com.fxtrader.core.model.Symbols;
import com.fxtrader.core.model.TradePlanEntry;
import com.fxtrader.core.model.TradeResult;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Watches open positions.
 *
 * Three loops run independently:
 * <ul>
 *   <li>SL/TP check every POSITION_CHECK_INTERVAL over registered positions, on cached quotes</li>
 *   <li>sweep every POSITION_CHECK_INTERVAL_MINUTES over every exchange position, force-closing
 *       those outside all plan windows</li>
 *   <li>per-trade watchdogs after a failed entry, closing any unrecognized position of the symbol</li>
 * </ul>
 * A registered position belongs to its scheduled exit until {@code exitAt} plus the exit retry
 * budget; the sweep leaves it alone until then.
 */
public class PositionMonitor {
    private static final Logger logger = LoggerFactory.getLogger(PositionMonitor.class);

    public static final Duration WATCHDOG_GRACE = Duration.ofMinutes(10);
    private static final Duration EXIT_BUDGET_SLACK = Duration.ofSeconds(60);

    private final ExchangeGateway gateway;
    private final OrderExecutor executor;
    private final PositionRegistry registry;
    private final Notifier notifier;
    private final Clock clock;
    private final Sleeper sleeper;

    private final double stopLossPips;
    private final double takeProfitPips;
    private final int jitterSeconds;
    private final Duration checkInterval;
    private final Duration sweepInterval;
    private final Duration exitBudget;

    private final ScheduledExecutorService checkScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "fx-position-check");
        t.setDaemon(true);
        return t;
    });
    private final ScheduledExecutorService sweepScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "fx-position-sweep");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService watchdogs = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "fx-watchdog");
        t.setDaemon(true);
        return t;
    });

    public PositionMonitor(Config config, ExchangeGateway gateway, OrderExecutor executor, PositionRegistry registry,
                           Notifier notifier, Clock clock, Sleeper sleeper) {
        this.gateway = gateway;
        this.executor = executor;
        this.registry = registry;
        this.notifier = notifier;
        this.clock = clock;
        this.sleeper = sleeper;
        this.stopLossPips = config.stopLossPips();
        this.takeProfitPips = config.takeProfitPips();
        this.jitterSeconds = config.jitterSeconds();
        this.checkInterval = config.positionCheckInterval();
        this.sweepInterval = config.sweepInterval();
        this.exitBudget = config.exitOrderRetryInterval()
            .multipliedBy(config.maxExitOrderAttempts())
            .plus(EXIT_BUDGET_SLACK);
    }

    /**
     * Start the SL/TP loop and the sweep.
     *
     * @param windows current plan rows, consulted on every sweep
     */
    public void start(Supplier<List<TradePlanEntry>> windows) {
        checkScheduler.scheduleWithFixedDelay(() -> {
            try {
                checkOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                logger.error("🚨 Position check failed", e);
                notifier.send("⚠️ Position monitor error: " + e.getMessage());
            }
        }, checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);

        sweepScheduler.scheduleWithFixedDelay(() -> {
            try {
                sweepOnce(LocalDateTime.now(clock), windows.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                logger.error("🚨 Position sweep failed", e);
                notifier.send("⚠️ Position sweep error: " + e.getMessage());
            }
        }, sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);

        logger.info("👀 Position monitor started: SL={} pips, TP={} pips, check every {}s, sweep every {}min",
            stopLossPips, takeProfitPips, checkInterval.toSeconds(), sweepInterval.toMinutes());
    }

    public void stop() {
        checkScheduler.shutdownNow();
        sweepScheduler.shutdownNow();
        watchdogs.shutdownNow();
    }

    // ==================== SL/TP ====================

    /**
     * One pass of the stop-loss/take-profit check over registered positions.
     */
    public List<TradeResult> checkOnce() throws InterruptedException {
        var positions = registry.all();
        var closed = new ArrayList<TradeResult>();
        if (positions.isEmpty() || (stopLossPips <= 0 && takeProfitPips <= 0)) {
            return closed;
        }

        Map<String, Quote> quotes;
        try {
            quotes = gateway.getCachedQuotes(registry.symbols());
        } catch (ApiException e) {
            logger.error("❌ Quotes for position check unavailable: {}", e.getMessage());
            return closed;
        }

        for (MonitoredPosition position : positions) {
            Quote quote = quotes.get(position.symbol());
            if (quote == null) {
                logger.warn("⚠️ No quote for {}, skipping SL/TP check of position {}", position.symbol(), position.positionId());
                continue;
            }
            double pips = unrealizedPips(position, quote);
            CloseReason trigger = trigger(pips);
            if (trigger == null) {
                continue;
            }
            logger.info("🎯 Position {} {} {} hit {} at {} pips", position.positionId(), position.side(),
                position.symbol(), trigger.label(), pips);
            notifier.send(String.format("%s %s %s reached %s: %.1f pips",
                trigger == CloseReason.STOP_LOSS ? "🛑" : "🎯", position.symbol(), position.side(), trigger.label(), pips));
            executor.close(position, trigger).ifPresent(closed::add);
        }
        return closed;
    }

    public static double unrealizedPips(MonitoredPosition position, Quote quote) {
        return Symbols.pips(position.entryPrice(), quote.markPrice(position.side()), position.side(), position.symbol());
    }

    private CloseReason trigger(double pips) {
        if (stopLossPips > 0 && pips <= -stopLossPips) {
            return CloseReason.STOP_LOSS;
        }
        if (takeProfitPips > 0 && pips >= takeProfitPips) {
            return CloseReason.TAKE_PROFIT;
        }
        return null;
    }

    // ==================== Sweep ====================

    /**
     * Force-close every exchange position that is open outside all plan windows.
     * Registered positions are skipped until their scheduled exit plus the exit retry budget has passed.
     */
    public List<TradeResult> sweepOnce(LocalDateTime now, List<TradePlanEntry> windows) throws InterruptedException {
        List<Position> open;
        try {
            open = gateway.getOpenPositions(null);
        } catch (ApiException e) {
            logger.error("❌ Sweep could not list open positions: {}", e.getMessage());
            return List.of();
        }

        var closed = new ArrayList<TradeResult>();
        for (Position position : open) {
            var tracked = registry.get(position.positionId());
            if (tracked.isPresent()) {
                var exitAt = tracked.get().scheduledExit();
                if (exitAt.isEmpty() || now.isBefore(exitAt.get().plus(exitBudget))) {
                    continue;
                }
                logger.warn("⚠️ Position {} still open {} after its scheduled exit", position.positionId(),
                    Duration.between(exitAt.get(), now));
            } else if (insideAnyWindow(position.symbol(), now, windows)) {
                continue;
            }

            logger.warn("🧹 Position {} {} {} is outside every trading window, closing",
                position.positionId(), position.side(), position.symbol());
            var monitored = tracked.orElseGet(() -> MonitoredPosition.unplanned(position, openedAt(position, now)));
            executor.close(monitored, CloseReason.SWEEP).ifPresent(closed::add);
        }

        if (!closed.isEmpty()) {
            double pips = closed.stream().mapToDouble(TradeResult::profitPips).sum();
            double amount = closed.stream().mapToDouble(TradeResult::profitAmount).sum();
            notifier.send(String.format("🧹 Closed %d position(s) outside the schedule: %+.1f pips, %+,.0f",
                closed.size(), pips, amount));
        }
        return closed;
    }

    /**
     * True when {@code now} falls inside a plan row for {@code symbol}, anchored today or yesterday
     * so windows crossing midnight are honoured. Entry may run up to JITTER_SECONDS early.
     */
    boolean insideAnyWindow(String symbol, LocalDateTime now, List<TradePlanEntry> windows) {
        LocalDate today = now.toLocalDate();
        for (TradePlanEntry entry : windows) {
            if (!entry.symbol().equals(symbol)) {
                continue;
            }
            for (LocalDate anchor : List.of(today, today.minusDays(1))) {
                LocalDateTime start = anchor.atTime(entry.entryTime()).minusSeconds(jitterSeconds);
                LocalDateTime end = anchor.atTime(entry.exitTime());
                if (!end.isAfter(anchor.atTime(entry.entryTime()))) {
                    end = end.plusDays(1);
                }
                if (!now.isBefore(start) && !now.isAfter(end)) {
                    return true;
                }
            }
        }
        return false;
    }

    private LocalDateTime openedAt(Position position, LocalDateTime fallback) {
        if (position.openTime() == null) {
            return fallback;
        }
        return LocalDateTime.ofInstant(position.openTime(), clock.getZone());
    }

    // ==================== Watchdog ====================

    /**
     * Run {@link #watch} in the background. A failing watchdog is logged and reported and
     * completes with no results.
     */
    public Future<List<TradeResult>> spawnWatchdog(ScheduledTrade trade) {
        LocalDateTime until = trade.exitAt().plus(WATCHDOG_GRACE);
        logger.info("🐕 Watchdog started for {} until {}", trade.symbol(), until);
        return watchdogs.submit(() -> {
            try {
                return watch(trade, until);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.<TradeResult>of();
            } catch (Exception e) {
                logger.error("🚨 Watchdog for row {} ({}) failed", trade.row(), trade.symbol(), e);
                notifier.send(String.format("⚠️ Watchdog for #%d %s failed: %s", trade.row(), trade.symbol(), e.getMessage()));
                return List.<TradeResult>of();
            }
        });
    }

    /**
     * Poll the symbol's positions every POSITION_CHECK_INTERVAL until {@code until}; any position
     * nobody tracks or is closing is force-closed and the watchdog ends.
     */
    public List<TradeResult> watch(ScheduledTrade trade, LocalDateTime until) throws InterruptedException {
        while (LocalDateTime.now(clock).isBefore(until)) {
            List<Position> strays = List.of();
            try {
                strays = gateway.getOpenPositions(trade.symbol()).stream()
                    .filter(p -> !registry.isTracked(p.positionId()))
                    .filter(p -> registry.claimOf(p.positionId()).isEmpty())
                    .toList();
            } catch (ApiException e) {
                logger.warn("⚠️ Watchdog check for {} failed: {}", trade.symbol(), e.getMessage());
            }
            if (!strays.isEmpty()) {
                logger.warn("🐕 Unrecognized {} position(s) found: {}", trade.symbol(), strays);
                var closed = new ArrayList<TradeResult>();
                for (Position stray : strays) {
                    var monitored = MonitoredPosition.unplanned(stray, openedAt(stray, LocalDateTime.now(clock)));
                    executor.close(monitored, CloseReason.WATCHDOG).ifPresent(result -> {
                        closed.add(result);
                        notifier.send(String.format("⚠️ Unrecognized position closed: %s %s", stray.symbol(), stray.side()));
                    });
                }
                return closed;
            }
            sleeper.sleep(checkInterval);
        }
        logger.info("🐕 Watchdog for row {} ({}) ended, nothing found", trade.row(), trade.symbol());
        return List.of();
    }
}
