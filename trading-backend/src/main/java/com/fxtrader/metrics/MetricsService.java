package com.fxtrader.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide metrics registry.
 *
 * The engine components register their meters (fx.api.*, fx.orders.*, fx.trades.profit) on
 * {@link #getRegistry()}; the admin server exposes {@link #scrape()} at /metrics.
 *
 * Initialization-on-Demand Holder: lazy and thread-safe without synchronization.
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;

    private MetricsService() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        logger.info("MetricsService initialized with Prometheus registry");
    }

    private static class Holder {
        private static final MetricsService INSTANCE = new MetricsService();
    }

    public static MetricsService getInstance() {
        return Holder.INSTANCE;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Prometheus text format for scraping.
     */
    public String scrape() {
        return registry.scrape();
    }

    public void recordNotification(String outcome) {
        registry.counter("fx.notifications", "outcome", outcome).increment();
    }

    public void recordBackup(boolean success) {
        registry.counter("fx.backups", "outcome", success ? "success" : "failure").increment();
    }

    public void recordAdminCommand(String command) {
        registry.counter("fx.admin.commands", "command", command).increment();
    }
}
