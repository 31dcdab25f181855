package com.fxtrader.admin;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fxtrader.backup.BackupService;
import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.execution.OrderExecutor;
import com.fxtrader.core.health.HealthMonitor;
import com.fxtrader.core.ledger.TradeLedger;
import com.fxtrader.core.metrics.PerformanceMetrics;
import com.fxtrader.core.model.Side;
import com.fxtrader.core.monitor.PositionRegistry;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.core.protection.EmergencyProtocol;
import com.fxtrader.core.risk.SizingException;
import com.fxtrader.core.supervisor.Supervisor;
import com.fxtrader.metrics.MetricsService;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.http.UnauthorizedResponse;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Privileged operator commands over HTTP.
 *
 * Every {@code /api/*} route requires {@code Authorization: Bearer <ADMIN_TOKEN>}; without a
 * configured token those routes are not registered at all. {@code /healthz} and {@code /metrics}
 * are open.
 */
public final class AdminServer {
    private static final Logger logger = LoggerFactory.getLogger(AdminServer.class);

    static final Map<String, String> COMMANDS = commandList();

    private final Javalin app;
    private final Optional<String> token;
    private final ExchangeGateway gateway;
    private final OrderExecutor executor;
    private final PositionRegistry registry;
    private final TradeLedger ledger;
    private final HealthMonitor healthMonitor;
    private final EmergencyProtocol emergency;
    private final Supervisor supervisor;
    private final BackupService backupService;
    private final Notifier notifier;
    private final Executor lifecycle;

    /**
     * @param lifecycle runs stop and restart after the response is sent; both end the process
     */
    public AdminServer(Optional<String> token, ExchangeGateway gateway, OrderExecutor executor,
                       PositionRegistry registry, TradeLedger ledger, HealthMonitor healthMonitor,
                       EmergencyProtocol emergency, Supervisor supervisor, BackupService backupService,
                       Notifier notifier, Executor lifecycle) {
        this.token = token.filter(t -> !t.isBlank());
        this.gateway = gateway;
        this.executor = executor;
        this.registry = registry;
        this.ledger = ledger;
        this.healthMonitor = healthMonitor;
        this.emergency = emergency;
        this.supervisor = supervisor;
        this.backupService = backupService;
        this.notifier = notifier;
        this.lifecycle = lifecycle;

        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            var objectMapper = new ObjectMapper();
            objectMapper.registerModule(new JavaTimeModule());
            objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
        });
        registerRoutes();
    }

    private void registerRoutes() {
        app.get("/healthz", ctx -> ctx.result("ok"));
        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(MetricsService.getInstance().scrape());
        });

        if (token.isEmpty()) {
            logger.warn("⚠️ ADMIN_TOKEN not set: admin commands disabled");
            return;
        }

        app.before("/api/*", this::authorize);
        app.exception(ApiException.class, (e, ctx) -> {
            logger.error("❌ Admin command failed at the exchange: {}", e.getMessage());
            ctx.status(HttpStatus.BAD_GATEWAY).json(Map.of("error", e.getMessage()));
        });
        app.exception(SizingException.class, (e, ctx) ->
            ctx.status(HttpStatus.BAD_REQUEST).json(Map.of("error", e.getMessage())));

        app.post("/api/kill", this::kill);
        app.post("/api/stop", this::stop);
        app.post("/api/restart", this::restart);
        app.get("/api/positions", this::positions);
        app.get("/api/status", this::status);
        app.get("/api/health", this::health);
        app.get("/api/performance", this::performance);
        app.post("/api/backup", this::backup);
        app.get("/api/testlot/{symbol}/{side}", this::testLot);
        app.get("/api/commands", ctx -> ctx.json(COMMANDS));
    }

    private void authorize(Context ctx) {
        String header = ctx.header("Authorization");
        String expected = "Bearer " + token.orElseThrow();
        if (header == null || !MessageDigest.isEqual(
                header.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("🚫 Unauthorized admin request {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
            throw new UnauthorizedResponse();
        }
        MetricsService.getInstance().recordAdminCommand(ctx.path().substring("/api/".length()).split("/")[0]);
    }

    // ==================== Commands ====================

    private void kill(Context ctx) throws InterruptedException {
        logger.warn("🧯 Kill requested by operator");
        notifier.send("🧯 Kill command received: closing all positions");
        ctx.json(emergency.flattenAll("operator kill"));
    }

    private void stop(Context ctx) {
        logger.warn("⏹️ Stop requested by operator");
        lifecycle.execute(() -> {
            try {
                supervisor.stop("operator command");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        ctx.status(HttpStatus.ACCEPTED).json(Map.of("status", "stopping"));
    }

    private void restart(Context ctx) {
        logger.warn("🔁 Restart requested by operator");
        lifecycle.execute(() -> {
            try {
                supervisor.autoRestart("operator command");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        ctx.status(HttpStatus.ACCEPTED).json(Map.of("status", "restart requested"));
    }

    private void positions(Context ctx) throws InterruptedException {
        var rows = gateway.getOpenPositions(null).stream()
            .map(p -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("positionId", p.positionId());
                row.put("symbol", p.symbol());
                row.put("side", p.side().name());
                row.put("size", p.size());
                row.put("entryPrice", p.entryPrice());
                row.put("openTime", p.openTime());
                row.put("tracked", registry.isTracked(p.positionId()));
                row.put("closing", registry.claimOf(p.positionId()).map(Enum::name).orElse(null));
                return row;
            })
            .toList();
        ctx.json(rows);
    }

    private void status(Context ctx) throws InterruptedException {
        Runtime runtime = Runtime.getRuntime();
        long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / 1024 / 1024;
        var stats = gateway.stats();

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("heapUsedMb", usedMb);
        snapshot.put("openPositions", gateway.getOpenPositions(null).size());
        snapshot.put("trackedPositions", registry.size());
        snapshot.put("rateLimit", stats.currentLimit());
        snapshot.put("throttleStreak", stats.throttleStreak());
        snapshot.put("apiCalls", stats.calls());
        snapshot.put("apiErrors", stats.errors());
        snapshot.put("results", ledger.history().size());
        snapshot.put("pendingResults", ledger.pending().size());
        snapshot.put("feeTotal", ledger.feeTotal());
        snapshot.put("executions", executor.states());
        snapshot.put("emergencyTriggered", emergency.isTriggered());
        snapshot.put("uptimeSeconds", healthMonitor.uptime().toSeconds());
        ctx.json(snapshot);
    }

    private void health(Context ctx) throws InterruptedException {
        var report = healthMonitor.checkHealth();
        ctx.status(report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE);
        ctx.json(Map.of(
            "status", report.overall().name(),
            "components", report.components(),
            "recommendation", report.recommendation(),
            "uptimeSeconds", report.uptimeSeconds()
        ));
    }

    private void performance(Context ctx) throws InterruptedException {
        var metrics = PerformanceMetrics.from(ledger.history(), gateway.stats(), healthMonitor.uptime());
        double balance = gateway.getAssets().balance();
        ctx.json(Map.of(
            "metrics", metrics,
            "winRate", metrics.winRate(),
            "averagePips", metrics.averagePips(),
            "apiSuccessRate", metrics.apiSuccessRate(),
            "report", metrics.format(balance)
        ));
    }

    private void backup(Context ctx) {
        try {
            var path = backupService.backup();
            notifier.send("🗄️ Backup completed: " + path);
            ctx.json(Map.of("status", "ok", "path", path.toString()));
        } catch (IOException e) {
            logger.error("❌ Backup failed", e);
            notifier.send("❌ Backup failed: " + e.getMessage());
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private void testLot(Context ctx) throws InterruptedException {
        String symbol = ctx.pathParam("symbol");
        Optional<Side> side = Side.parse(ctx.pathParam("side"));
        if (side.isEmpty()) {
            ctx.status(HttpStatus.BAD_REQUEST).json(Map.of("error", "side must be BUY or SELL"));
            return;
        }
        long size = executor.previewSize(symbol, side.get());
        ctx.json(Map.of("symbol", symbol, "side", side.get().name(), "size", size));
    }

    // ==================== Lifecycle ====================

    /**
     * @param port 0 picks a free port
     * @return the bound port
     */
    public int start(int port) {
        app.start(port);
        logger.info("🛠️ Admin server listening on port {} (commands {})", app.port(),
            token.isPresent() ? "enabled" : "disabled");
        return app.port();
    }

    public void stop() {
        app.stop();
        logger.info("Admin server stopped");
    }

    private static Map<String, String> commandList() {
        Map<String, String> commands = new LinkedHashMap<>();
        commands.put("POST /api/kill", "Close every open position and record the results");
        commands.put("POST /api/stop", "Close everything, then stop the bot");
        commands.put("POST /api/restart", "Guarded restart (cooldown and restart limit apply)");
        commands.put("GET /api/positions", "Open positions at the exchange");
        commands.put("GET /api/status", "Runtime snapshot: memory, positions, rate limit, results, fees");
        commands.put("GET /api/health", "Run a health check now");
        commands.put("GET /api/performance", "Performance report");
        commands.put("POST /api/backup", "Take a backup now");
        commands.put("GET /api/testlot/{symbol}/{side}", "Dry-run lot sizing, no order is sent");
        commands.put("GET /api/commands", "This list");
        return Collections.unmodifiableMap(commands);
    }
}
