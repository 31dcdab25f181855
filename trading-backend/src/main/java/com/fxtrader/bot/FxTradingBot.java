package com.fxtrader.bot;

import com.fxtrader.admin.AdminServer;
import com.fxtrader.backup.BackupService;
import com.fxtrader.core.api.ForexApiClient;
import com.fxtrader.core.config.Config;
import com.fxtrader.core.execution.OrderExecutor;
import com.fxtrader.core.health.HealthMonitor;
import com.fxtrader.core.ledger.TradeLedger;
import com.fxtrader.core.monitor.PositionMonitor;
import com.fxtrader.core.monitor.PositionRegistry;
import com.fxtrader.core.protection.EmergencyProtocol;
import com.fxtrader.core.risk.DailyVolumeLedger;
import com.fxtrader.core.risk.PositionSizer;
import com.fxtrader.core.risk.ProfitCalculator;
import com.fxtrader.core.schedule.TradeScheduler;
import com.fxtrader.core.supervisor.RestartGuard;
import com.fxtrader.core.supervisor.Supervisor;
import com.fxtrader.core.time.Sleeper;
import com.fxtrader.export.CsvResultExporter;
import com.fxtrader.metrics.MetricsService;
import com.fxtrader.notifications.WebhookNotifier;
import com.fxtrader.plan.CsvTradePlanLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * FX auto-trading bot entry point: wires the engine, starts the background loops and runs the
 * plan day after day.
 */
public final class FxTradingBot {
    private static final Logger logger = LoggerFactory.getLogger(FxTradingBot.class);
    private static final Duration BACKUP_INTERVAL = Duration.ofHours(24);
    private static final Duration PLAN_RETRY_DELAY = Duration.ofMinutes(1);

    private FxTradingBot() {
    }

    public static void main(String[] args) {
        Config config;
        try {
            config = Config.load();
        } catch (IllegalStateException e) {
            logger.error("❌ {}", e.getMessage());
            System.exit(1);
            return;
        }

        var clock = Clock.systemDefaultZone();
        var sleeper = Sleeper.SYSTEM;
        var meters = MetricsService.getInstance().getRegistry();
        var process = new JvmProcessControl();

        var notifier = new WebhookNotifier(config.webhookUrl());
        if (!Files.isRegularFile(config.tradesFile())) {
            logger.error("❌ Trade plan {} not found", config.tradesFile().toAbsolutePath());
            notifier.send("❌ " + config.tradesFile() + " not found. The bot is stopping.");
            process.halt("trade plan missing");
            return;
        }

        var gateway = new ForexApiClient(config, meters, clock, sleeper);
        var sizer = new PositionSizer(gateway, config.riskRatio());
        var profitCalculator = new ProfitCalculator(gateway);
        var volumeLedger = new DailyVolumeLedger(config.symbolDailyVolumeLimit());
        var tradeLedger = new TradeLedger();
        var registry = new PositionRegistry();

        var executor = new OrderExecutor(config, gateway, sizer, profitCalculator, volumeLedger,
            tradeLedger, registry, notifier, meters, clock, sleeper);
        var monitor = new PositionMonitor(config, gateway, executor, registry, notifier, clock, sleeper);
        var scheduler = new TradeScheduler(config,
            new CsvTradePlanLoader(config.tradesFile(), notifier),
            new CsvResultExporter(config.resultsDir()),
            gateway, executor, monitor, registry, tradeLedger, notifier, clock, sleeper);

        List<Path> requiredFiles = new ArrayList<>();
        requiredFiles.add(config.tradesFile());
        if (Files.exists(config.configFile())) {
            requiredFiles.add(config.configFile());
        }
        var healthMonitor = new HealthMonitor(gateway, notifier, requiredFiles, config.resultsDir(),
            HealthMonitor.ResourceProbe.RUNTIME, clock);
        var emergency = new EmergencyProtocol(gateway, executor, registry, notifier, clock);
        var supervisor = new Supervisor(config, scheduler, healthMonitor, emergency, volumeLedger,
            new RestartGuard(clock), notifier, process, clock);
        var backupService = new BackupService(config.backupDir(),
            List.of(config.configFile(), config.tradesFile()), config.resultsDir(), clock);

        var lifecycle = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "fx-lifecycle");
            t.setDaemon(true);
            return t;
        });
        var admin = new AdminServer(config.adminToken(), gateway, executor, registry, tradeLedger,
            healthMonitor, emergency, supervisor, backupService, notifier, lifecycle);

        logger.info("🚀 FX trading bot starting: {}", config.summary());
        notifier.send("🚀 FX trading bot started\n" + config.summary());

        var backups = startBackups(backupService, notifier);
        monitor.start(scheduler::currentPlan);
        supervisor.start();
        admin.start(config.adminPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("👋 Shutting down");
            monitor.stop();
            supervisor.shutdown();
            backups.shutdownNow();
            admin.stop();
        }, "fx-shutdown"));

        runForever(scheduler, supervisor, notifier);
    }

    private static void runForever(TradeScheduler scheduler, Supervisor supervisor, WebhookNotifier notifier) {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                scheduler.runDay();
                scheduler.waitForNextCycle();
            } catch (IOException e) {
                logger.error("❌ Trade plan unreadable", e);
                notifier.send("❌ Could not read the trade plan: " + e.getMessage());
                try {
                    Sleeper.SYSTEM.sleep(PLAN_RETRY_DELAY);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                logger.error("🚨 Trading loop crashed", e);
                notifier.send("🚨 Trading loop error: " + e.getMessage());
                try {
                    supervisor.autoRestart("trading loop crashed: " + e.getMessage());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        logger.info("Trading loop interrupted, exiting");
    }

    private static ScheduledExecutorService startBackups(BackupService backupService, WebhookNotifier notifier) {
        var backups = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fx-backup");
            t.setDaemon(true);
            return t;
        });
        backups.scheduleAtFixedRate(() -> {
            try {
                var path = backupService.backup();
                notifier.send("🗄️ Backup completed: " + path);
            } catch (IOException e) {
                logger.error("❌ Backup failed", e);
                notifier.send("❌ Backup failed: " + e.getMessage());
            }
        }, 0, BACKUP_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        return backups;
    }
}
