package com.fxtrader.core.health;

import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Health Monitor - periodic self-check of everything the bot needs to keep trading.
 *
 * Monitors:
 * - Exchange API reachability (account balance call)
 * - Notification channel reachability
 * - Free disk space
 * - Heap usage
 * - Required files (the results directory is created when missing)
 */
public class HealthMonitor {
    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    public static final long MIN_FREE_DISK_BYTES = 1024L * 1024 * 1024;
    public static final long MAX_USED_HEAP_BYTES = 500L * 1024 * 1024;

    public enum HealthStatus {
        HEALTHY,    // All systems operational
        DEGRADED,   // Minor issues, continue with caution
        CRITICAL    // Restart needed
    }

    public record ComponentHealth(
        String component,
        HealthStatus status,
        String message,
        Instant lastCheck
    ) {}

    public record HealthReport(
        HealthStatus overall,
        List<ComponentHealth> components,
        Instant timestamp,
        long uptimeSeconds,
        String recommendation
    ) {
        public boolean isHealthy() {
            return overall != HealthStatus.CRITICAL;
        }

        public List<ComponentHealth> failures() {
            return components.stream().filter(c -> c.status() == HealthStatus.CRITICAL).toList();
        }

        public String format() {
            String lines = components.stream()
                .map(c -> String.format("%s %s: %s", icon(c.status()), c.component(), c.message()))
                .collect(Collectors.joining("\n"));
            return String.format("🩺 Health: %s%n%s%n%s", overall, lines, recommendation);
        }

        private static String icon(HealthStatus status) {
            return switch (status) {
                case HEALTHY -> "✅";
                case DEGRADED -> "⚠️";
                case CRITICAL -> "❌";
            };
        }
    }

    /**
     * Host resource readings, replaceable in tests.
     */
    public interface ResourceProbe {
        long usedHeapBytes();

        long usableDiskBytes(Path path) throws IOException;

        ResourceProbe RUNTIME = new ResourceProbe() {
            @Override
            public long usedHeapBytes() {
                Runtime runtime = Runtime.getRuntime();
                return runtime.totalMemory() - runtime.freeMemory();
            }

            @Override
            public long usableDiskBytes(Path path) throws IOException {
                return Files.getFileStore(path).getUsableSpace();
            }
        };
    }

    private final ExchangeGateway gateway;
    private final Notifier notifier;
    private final List<Path> requiredFiles;
    private final Path resultsDir;
    private final ResourceProbe probe;
    private final Clock clock;
    private final Instant startTime;
    private final AtomicReference<HealthReport> lastReport = new AtomicReference<>();

    public HealthMonitor(ExchangeGateway gateway, Notifier notifier, List<Path> requiredFiles,
                         Path resultsDir, ResourceProbe probe, Clock clock) {
        this.gateway = gateway;
        this.notifier = notifier;
        this.requiredFiles = List.copyOf(requiredFiles);
        this.resultsDir = resultsDir;
        this.probe = probe;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    /**
     * Perform comprehensive health check.
     */
    public HealthReport checkHealth() throws InterruptedException {
        List<ComponentHealth> components = new ArrayList<>();
        components.add(checkExchange());
        components.add(checkNotifier());
        components.add(checkDisk());
        components.add(checkMemory());
        components.add(checkFiles());

        // Worst of all components
        HealthStatus overall = components.stream()
            .map(ComponentHealth::status)
            .max(Comparator.naturalOrder())
            .orElse(HealthStatus.HEALTHY);

        String recommendation = switch (overall) {
            case HEALTHY -> "All systems operational. Continue trading.";
            case DEGRADED -> "Minor issues detected. Monitor closely.";
            case CRITICAL -> "Critical issues. Restart required.";
        };

        Instant now = clock.instant();
        long uptime = Duration.between(startTime, now).getSeconds();
        HealthReport report = new HealthReport(overall, components, now, uptime, recommendation);
        lastReport.set(report);

        if (report.isHealthy()) {
            logger.info("🩺 Health check passed ({})", overall);
        } else {
            logger.error("❌ Health check failed: {}", report.failures());
        }
        return report;
    }

    private ComponentHealth checkExchange() throws InterruptedException {
        try {
            var assets = gateway.getAssets();
            return component("Exchange API", HealthStatus.HEALTHY, String.format("Connected, balance %,.0f", assets.balance()));
        } catch (RuntimeException e) {
            return component("Exchange API", HealthStatus.CRITICAL, "Unreachable: " + e.getMessage());
        }
    }

    private ComponentHealth checkNotifier() {
        return notifier.ping()
            ? component("Notifications", HealthStatus.HEALTHY, "Reachable")
            : component("Notifications", HealthStatus.CRITICAL, "Webhook unreachable");
    }

    private ComponentHealth checkDisk() {
        try {
            long free = probe.usableDiskBytes(Path.of(".").toAbsolutePath());
            String freeStr = String.format("%.1fGB free", free / 1024.0 / 1024 / 1024);
            return free >= MIN_FREE_DISK_BYTES
                ? component("Disk", HealthStatus.HEALTHY, freeStr)
                : component("Disk", HealthStatus.CRITICAL, "Low: " + freeStr);
        } catch (IOException e) {
            return component("Disk", HealthStatus.DEGRADED, "Check failed: " + e.getMessage());
        }
    }

    private ComponentHealth checkMemory() {
        long used = probe.usedHeapBytes();
        String usageStr = String.format("%dMB used", used / 1024 / 1024);
        return used <= MAX_USED_HEAP_BYTES
            ? component("Memory", HealthStatus.HEALTHY, usageStr)
            : component("Memory", HealthStatus.CRITICAL, "High: " + usageStr);
    }

    private ComponentHealth checkFiles() {
        var missing = requiredFiles.stream().filter(p -> !Files.exists(p)).toList();
        if (!missing.isEmpty()) {
            return component("Files", HealthStatus.CRITICAL, "Missing: " + missing);
        }
        if (!Files.isDirectory(resultsDir)) {
            try {
                Files.createDirectories(resultsDir);
                logger.info("📁 Created results directory {}", resultsDir);
            } catch (IOException e) {
                return component("Files", HealthStatus.CRITICAL, "Cannot create " + resultsDir + ": " + e.getMessage());
            }
        }
        return component("Files", HealthStatus.HEALTHY, "All present");
    }

    private ComponentHealth component(String name, HealthStatus status, String message) {
        return new ComponentHealth(name, status, message, clock.instant());
    }

    /**
     * Get last health report.
     */
    public HealthReport getLastReport() {
        return lastReport.get();
    }

    public Duration uptime() {
        return Duration.between(startTime, clock.instant());
    }
}
