package com.fxtrader.core.schedule;

import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.config.Config;
import com.fxtrader.core.execution.OrderExecutor;
import com.fxtrader.core.ledger.TradeLedger;
import com.fxtrader.core.model.CloseReason;
import com.fxtrader.core.model.ScheduledTrade;
import com.fxtrader.core.model.Symbols;
import com.fxtrader.core.model.TradePlanEntry;
import com.fxtrader.core.model.TradeResult;
import com.fxtrader.core.monitor.MonitoredPosition;
import com.fxtrader.core.monitor.PositionMonitor;
import com.fxtrader.core.monitor.PositionRegistry;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Drives one trading day from the plan.
 *
 * Plan rows are resolved to absolute timestamps, then worked through in entry order: wait for
 * the entry (minus jitter), enter, wait for the exit (minus jitter) while the monitor watches,
 * close. Results are aggregated at the daily cutoff by {@link #finalizeDay}.
 */
public class TradeScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TradeScheduler.class);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** An entry reached later than this after its time is skipped rather than chased. */
    static final Duration LATE_ENTRY_TOLERANCE = Duration.ofMinutes(1);
    private static final Duration NEXT_DAY_LEAD = Duration.ofSeconds(60);

    private final Config config;
    private final TradePlanSource planSource;
    private final DailyReportSink reportSink;
    private final ExchangeGateway gateway;
    private final OrderExecutor executor;
    private final PositionMonitor monitor;
    private final PositionRegistry registry;
    private final TradeLedger ledger;
    private final Notifier notifier;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier unitRandom;

    private volatile List<TradePlanEntry> currentPlan = List.of();

    public TradeScheduler(Config config, TradePlanSource planSource, DailyReportSink reportSink,
                          ExchangeGateway gateway, OrderExecutor executor, PositionMonitor monitor,
                          PositionRegistry registry, TradeLedger ledger, Notifier notifier,
                          Clock clock, Sleeper sleeper) {
        this(config, planSource, reportSink, gateway, executor, monitor, registry, ledger, notifier,
            clock, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public TradeScheduler(Config config, TradePlanSource planSource, DailyReportSink reportSink,
                          ExchangeGateway gateway, OrderExecutor executor, PositionMonitor monitor,
                          PositionRegistry registry, TradeLedger ledger, Notifier notifier,
                          Clock clock, Sleeper sleeper, DoubleSupplier unitRandom) {
        this.config = config;
        this.planSource = planSource;
        this.reportSink = reportSink;
        this.gateway = gateway;
        this.executor = executor;
        this.monitor = monitor;
        this.registry = registry;
        this.ledger = ledger;
        this.notifier = notifier;
        this.clock = clock;
        this.sleeper = sleeper;
        this.unitRandom = unitRandom;
    }

    // ==================== Resolution ====================

    /**
     * Resolve plan rows to absolute entry/exit timestamps.
     *
     * Entry is placed today, moved forward a day while it is not after {@code now} or falls
     * before the previous cycle's last exit. Exit lands on the entry's date, or the next day
     * when it would not be after the entry. Sorted by entry.
     */
    public static List<ScheduledTrade> resolve(List<TradePlanEntry> plan, LocalDateTime now,
                                               Optional<LocalDateTime> lastExit) {
        var trades = new ArrayList<ScheduledTrade>();
        for (TradePlanEntry entry : plan) {
            LocalDateTime entryAt = now.toLocalDate().atTime(entry.entryTime());
            while (!entryAt.isAfter(now) || (lastExit.isPresent() && entryAt.isBefore(lastExit.get()))) {
                entryAt = entryAt.plusDays(1);
            }
            LocalDateTime exitAt = entryAt.toLocalDate().atTime(entry.exitTime());
            if (!exitAt.isAfter(entryAt)) {
                exitAt = exitAt.plusDays(1);
            }
            trades.add(new ScheduledTrade(entry, entryAt, exitAt));
        }
        trades.sort(Comparator.comparing(ScheduledTrade::entryAt).thenComparing(ScheduledTrade::row));
        return trades;
    }

    // ==================== Day loop ====================

    /**
     * Load the plan and work through it. Returns once every trade has been entered and exited
     * (or skipped).
     */
    public List<ScheduledTrade> runDay() throws IOException, InterruptedException {
        List<TradePlanEntry> plan = planSource.load();
        currentPlan = List.copyOf(plan);
        if (plan.isEmpty()) {
            logger.warn("⚠️ Trade plan is empty");
            notifier.send("⚠️ No valid trades in the plan");
            return List.of();
        }

        executor.clearFinished();
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<LocalDateTime> lastExit = ledger.lastExitTime();
        var trades = resolve(plan, now, lastExit);
        notifier.send(entryList(trades, lastExit.filter(exit -> shiftedByPreviousExit(plan, now, exit))));

        for (ScheduledTrade trade : trades) {
            runTrade(trade);
        }
        logger.info("🏁 All {} trade(s) of the plan processed", trades.size());
        return trades;
    }

    /**
     * Enter, hold and exit one trade.
     */
    void runTrade(ScheduledTrade trade) throws InterruptedException {
        LocalDateTime now = LocalDateTime.now(clock);
        if (now.isAfter(trade.entryAt().plus(LATE_ENTRY_TOLERANCE))) {
            logger.warn("⏭️ Row {} entry time {} already passed, skipping", trade.row(), trade.entryAt());
            notifier.send(String.format("⏭️ Skipped #%d %s %s: entry time %s already passed",
                trade.row(), trade.side(), trade.symbol(), trade.entryAt().format(DATE_TIME)));
            return;
        }

        sleeper.sleepUntil(clock, trade.entryAt().minus(jitter()));
        Optional<MonitoredPosition> position = executor.enter(trade);
        if (position.isEmpty()) {
            position = executor.adopt(trade);
        }
        if (position.isEmpty()) {
            monitor.spawnWatchdog(trade);
            return;
        }

        MonitoredPosition opened = position.get();
        registry.register(opened);
        sleeper.sleepUntil(clock, trade.exitAt().minus(jitter()));
        if (registry.isTracked(opened.positionId())) {
            executor.close(opened, CloseReason.SCHEDULED);
        } else {
            logger.info("Position {} already closed before its scheduled exit", opened.positionId());
        }
    }

    private static boolean shiftedByPreviousExit(List<TradePlanEntry> plan, LocalDateTime now, LocalDateTime lastExit) {
        return plan.stream()
            .map(e -> now.toLocalDate().atTime(e.entryTime()))
            .anyMatch(naive -> naive.isAfter(now) && naive.isBefore(lastExit));
    }

    private Duration jitter() {
        long millis = Math.round(unitRandom.getAsDouble() * config.jitterSeconds() * 1000);
        return Duration.ofMillis(millis);
    }

    private String entryList(List<ScheduledTrade> trades, Optional<LocalDateTime> continuedFrom) {
        var sb = new StringBuilder("📋 Today's entries\n");
        continuedFrom.ifPresent(t -> sb.append("⏩ Continuing after previous exit at ").append(t.format(DATE_TIME)).append('\n'));
        for (ScheduledTrade t : trades) {
            sb.append(String.format("#%d %s %s lot=%s  %s -> %s%n", t.row(), t.entry().rawSide(), t.symbol(),
                t.entry().lotLabel(), t.entryAt().format(DATE_TIME), t.exitAt().format(DATE_TIME)));
        }
        sb.append(String.format("Balance: %s | Leverage: %d | AutoLot: %s | Sweep: %dmin | SL: %s | TP: %s",
            balanceText(), config.leverage(), config.autoLot() ? "ON" : "OFF", config.positionCheckIntervalMinutes(),
            config.stopLossPips() > 0 ? config.stopLossPips() + " pips" : "off",
            config.takeProfitPips() > 0 ? config.takeProfitPips() + " pips" : "off"));
        return sb.toString();
    }

    // ==================== Next day ====================

    /**
     * First entry of the plan as it would resolve now, honouring the last recorded exit.
     */
    public Optional<LocalDateTime> nextFirstEntry() throws IOException {
        var plan = planSource.load();
        return resolve(plan, LocalDateTime.now(clock), ledger.lastExitTime()).stream()
            .map(ScheduledTrade::entryAt)
            .findFirst();
    }

    /**
     * Sleep until shortly before the next cycle's first entry.
     */
    public void waitForNextCycle() throws IOException, InterruptedException {
        var next = nextFirstEntry();
        if (next.isEmpty()) {
            logger.warn("⚠️ No upcoming entry, checking the plan again in an hour");
            sleeper.sleep(Duration.ofHours(1));
            return;
        }
        LocalDateTime wakeAt = next.get().minusSeconds(config.jitterSeconds()).minus(NEXT_DAY_LEAD);
        logger.info("💤 Waiting until {} for the next cycle (first entry {})", wakeAt, next.get());
        notifier.send("💤 Next entry at " + next.get().format(DATE_TIME));
        sleeper.sleepUntil(clock, wakeAt);
    }

    public List<TradePlanEntry> currentPlan() {
        return currentPlan;
    }

    // ==================== End of day ====================

    /**
     * Report and export every result that exited before the cutoff on {@code date}; later results
     * stay for the next report. Resets the day's fee total.
     */
    public List<TradeResult> finalizeDay(LocalDate date) {
        LocalDateTime cutoff = date.atTime(config.dailyCutoffHour(), 0);
        var results = ledger.drainBefore(cutoff);
        double fees = ledger.feeTotal();
        ledger.resetFees();

        if (results.isEmpty()) {
            logger.info("📭 No trades for {} until {}:00", date, config.dailyCutoffHour());
            notifier.send(String.format("📭 %s: no trades until %d:00", date, config.dailyCutoffHour()));
            return results;
        }

        notifier.send(dayReport(date, results, fees));
        try {
            reportSink.export(date, results);
            logger.info("💾 Exported {} result(s) for {}", results.size(), date);
        } catch (IOException e) {
            logger.error("❌ Export of {} results failed", date, e);
            notifier.send("❌ Daily result export failed: " + e.getMessage());
        }
        return results;
    }

    String dayReport(LocalDate date, List<TradeResult> results, double fees) {
        var sb = new StringBuilder();
        sb.append(String.format("📊 Daily report %s (until %d:00)%n", date, config.dailyCutoffHour()));
        sb.append("| Symbol | Side | Entry | Exit | Lot | Pips | Amount | Time |\n");
        sb.append("|---|---|---|---|---|---|---|---|\n");
        for (TradeResult r : results) {
            sb.append(String.format(Locale.ROOT, "| %s | %s | %s | %s | %,d | %+.1f | %+,.0f | %s-%s |%n",
                r.symbol(), r.side(), Symbols.formatPrice(r.entryPrice(), r.symbol()),
                Symbols.formatPrice(r.exitPrice(), r.symbol()), r.lotSize(), r.profitPips(), r.profitAmount(),
                r.entryTime().format(TIME), r.exitTime().format(TIME)));
        }
        double pips = results.stream().mapToDouble(TradeResult::profitPips).sum();
        double amount = results.stream().mapToDouble(TradeResult::profitAmount).sum();
        sb.append(String.format(Locale.ROOT, "Total: %+.1f pips, %+,.0f%n", pips, amount));
        sb.append(String.format(Locale.ROOT, "Fees: %,.0f%n", fees));
        sb.append("Balance: ").append(balanceText());
        return sb.toString();
    }

    private String balanceText() {
        try {
            return String.format(Locale.ROOT, "%,.0f", gateway.getAssets().balance());
        } catch (ApiException e) {
            logger.warn("⚠️ Balance lookup failed: {}", e.getMessage());
            return "unavailable";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "unavailable";
        }
    }
}
