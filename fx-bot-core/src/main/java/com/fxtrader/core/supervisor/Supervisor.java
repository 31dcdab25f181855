package com.fxtrader.core.supervisor;

import com.fxtrader.core.config.Config;
import com.fxtrader.core.health.HealthMonitor;
import com.fxtrader.core.health.HealthMonitor.HealthReport;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.core.notify.ProcessControl;
import com.fxtrader.core.protection.EmergencyProtocol;
import com.fxtrader.core.risk.DailyVolumeLedger;
import com.fxtrader.core.schedule.TradeScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide lifecycle: end-of-day finalize, optional daily restart, midnight volume reset
 * and the 6-hourly health check. Each loop runs on its own scheduler thread.
 *
 * A failed health check asks for an automatic restart, bounded by the {@link RestartGuard}.
 * Every restart and stop flattens open positions first.
 */
public class Supervisor {
    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    public static final Duration HEALTH_CHECK_INTERVAL = Duration.ofHours(6);

    private final Config config;
    private final TradeScheduler scheduler;
    private final HealthMonitor healthMonitor;
    private final EmergencyProtocol emergency;
    private final DailyVolumeLedger volumeLedger;
    private final RestartGuard restartGuard;
    private final Notifier notifier;
    private final ProcessControl process;
    private final Clock clock;

    private final List<ScheduledExecutorService> loops = new ArrayList<>();

    public Supervisor(Config config, TradeScheduler scheduler, HealthMonitor healthMonitor,
                      EmergencyProtocol emergency, DailyVolumeLedger volumeLedger, RestartGuard restartGuard,
                      Notifier notifier, ProcessControl process, Clock clock) {
        this.config = config;
        this.scheduler = scheduler;
        this.healthMonitor = healthMonitor;
        this.emergency = emergency;
        this.volumeLedger = volumeLedger;
        this.restartGuard = restartGuard;
        this.notifier = notifier;
        this.process = process;
        this.clock = clock;
    }

    public void start() {
        scheduleDaily("fx-finalize", LocalTime.of(config.dailyCutoffHour(), 0), this::finalizeToday);
        config.autoRestartHour().ifPresent(hour ->
            scheduleDaily("fx-daily-restart", LocalTime.of(hour % 24, 0), this::dailyRestart));
        scheduleDaily("fx-volume-reset", LocalTime.MIDNIGHT, this::resetVolumes);

        var health = newLoop("fx-health");
        health.scheduleWithFixedDelay(this::healthCheck,
            HEALTH_CHECK_INTERVAL.toMillis(), HEALTH_CHECK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);

        String restart = config.autoRestartHour().isPresent()
            ? "daily restart at " + (config.autoRestartHour().getAsInt() % 24) + ":00"
            : "daily restart off";
        logger.info("🛡️ Supervisor started: finalize at {}:00, {}, health every {}h",
            config.dailyCutoffHour(), restart, HEALTH_CHECK_INTERVAL.toHours());
        notifier.send("🛡️ Supervisor started: " + restart + ", auto-restart max "
            + restartGuard.maxRestarts() + " per process");
    }

    public void shutdown() {
        loops.forEach(ScheduledExecutorService::shutdownNow);
    }

    // ==================== Loops ====================

    void finalizeToday() {
        scheduler.finalizeDay(LocalDate.now(clock));
    }

    void resetVolumes() {
        volumeLedger.reset();
        notifier.send("🔄 Daily volume limits reset");
    }

    void dailyRestart() {
        logger.info("🔁 Scheduled daily restart");
        notifier.send("🔁 Scheduled daily restart: closing positions first");
        try {
            emergency.trigger("scheduled restart");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        process.restart();
    }

    void healthCheck() {
        try {
            HealthReport report = healthMonitor.checkHealth();
            if (!report.isHealthy()) {
                notifier.send(report.format());
                autoRestart("health check failed: " + report.failures().stream()
                    .map(HealthMonitor.ComponentHealth::component).toList());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ==================== Restart / stop ====================

    /**
     * Restart if the guard allows it; halt for good once the restart budget is spent.
     */
    public RestartGuard.Decision autoRestart(String reason) throws InterruptedException {
        var decision = restartGuard.tryAcquire();
        switch (decision) {
            case ALLOWED -> {
                logger.warn("🔁 Auto-restart ({}/{}): {}", restartGuard.restarts(), restartGuard.maxRestarts(), reason);
                notifier.send(String.format("🔁 Auto-restart %d/%d: %s", restartGuard.restarts(),
                    restartGuard.maxRestarts(), reason));
                emergency.trigger("restart: " + reason);
                process.restart();
            }
            case COOLDOWN -> notifier.send("⏳ Restart suppressed (cooldown): " + reason);
            case EXHAUSTED -> {
                logger.error("🛑 Restart budget exhausted, halting: {}", reason);
                notifier.send(String.format("🛑 Auto-restart limit (%d) reached. Halting, manual intervention required. Last reason: %s",
                    restartGuard.maxRestarts(), reason));
                emergency.trigger("halt: " + reason);
                process.halt("restart limit reached: " + reason);
            }
        }
        return decision;
    }

    /**
     * Full stop: best-effort close of everything, then halt.
     */
    public void stop(String reason) throws InterruptedException {
        logger.warn("⏹️ Stop requested: {}", reason);
        notifier.send("⏹️ Stopping: " + reason);
        emergency.trigger("stop: " + reason);
        process.halt(reason);
    }

    // ==================== Scheduling ====================

    private void scheduleDaily(String name, LocalTime at, Runnable task) {
        var loop = newLoop(name);
        scheduleNext(loop, name, at, task);
    }

    private void scheduleNext(ScheduledExecutorService loop, String name, LocalTime at, Runnable task) {
        Duration delay = delayUntil(LocalDateTime.now(clock), at);
        logger.debug("{} next run in {}", name, delay);
        loop.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                logger.error("🚨 {} failed", name, e);
                notifier.send("⚠️ " + name + " failed: " + e.getMessage());
            } finally {
                if (!loop.isShutdown()) {
                    scheduleNext(loop, name, at, task);
                }
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Time from {@code now} to the next occurrence of {@code at}, strictly in the future.
     */
    static Duration delayUntil(LocalDateTime now, LocalTime at) {
        LocalDateTime next = now.toLocalDate().atTime(at);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next);
    }

    private ScheduledExecutorService newLoop(String name) {
        var loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        loops.add(loop);
        return loop;
    }
}
