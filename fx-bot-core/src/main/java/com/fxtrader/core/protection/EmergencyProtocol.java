package com.fxtrader.core.protection;

import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.execution.OrderExecutor;
import com.fxtrader.core.model.CloseReason;
import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.TradeResult;
import com.fxtrader.core.monitor.MonitoredPosition;
import com.fxtrader.core.monitor.PositionRegistry;
import com.fxtrader.core.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes every open position at the exchange.
 *
 * {@link #flattenAll} is the repeatable operator "kill". {@link #trigger} is the one-shot variant
 * used before stop and restart: only the first caller flattens, later ones get the first result.
 * Every close goes through {@link OrderExecutor#close}, so positions another path is already
 * closing are left to it.
 */
public class EmergencyProtocol {
    private static final Logger logger = LoggerFactory.getLogger(EmergencyProtocol.class);

    private final ExchangeGateway gateway;
    private final OrderExecutor executor;
    private final PositionRegistry registry;
    private final Notifier notifier;
    private final Clock clock;

    private final AtomicBoolean triggered = new AtomicBoolean(false);
    private volatile Map<String, Object> lastExecutionResult;
    private volatile String lastTriggerReason;

    public EmergencyProtocol(ExchangeGateway gateway, OrderExecutor executor, PositionRegistry registry,
                             Notifier notifier, Clock clock) {
        this.gateway = gateway;
        this.executor = executor;
        this.registry = registry;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Flatten once. Duplicate calls are ignored until {@link #reset}.
     */
    public Map<String, Object> trigger(String reason) throws InterruptedException {
        if (!triggered.compareAndSet(false, true)) {
            logger.warn("Emergency protocol already triggered! Ignoring duplicate request: {}", reason);
            return Map.of(
                "status", "already_triggered",
                "lastReason", lastTriggerReason != null ? lastTriggerReason : "unknown"
            );
        }
        lastTriggerReason = reason;
        logger.error("🚨 EMERGENCY PROTOCOL ACTIVATED: {} 🚨", reason);
        var result = new HashMap<>(flattenAll(reason));
        result.put("status", "triggered");
        lastExecutionResult = result;
        return result;
    }

    /**
     * Close every open position, best effort. Failures are reported, not retried beyond the
     * executor's own exit attempts.
     */
    public Map<String, Object> flattenAll(String reason) throws InterruptedException {
        Map<String, Object> result = new HashMap<>();
        result.put("reason", reason);
        result.put("timestamp", LocalDateTime.now(clock).toString());

        List<Position> positions;
        try {
            positions = gateway.getOpenPositions(null);
        } catch (ApiException e) {
            logger.error("❌ Failed to fetch positions for closure", e);
            notifier.send("🚨 Could not list open positions for " + reason + ": " + e.getMessage());
            result.put("success", false);
            result.put("error", e.getMessage());
            return result;
        }

        var closed = new ArrayList<TradeResult>();
        var outcomes = new ArrayList<Map<String, Object>>();
        int failed = 0;
        for (Position pos : positions) {
            if (registry.claimOf(pos.positionId()).isPresent()) {
                outcomes.add(outcome(pos, "in_progress"));
                continue;
            }
            var monitored = registry.get(pos.positionId())
                .orElseGet(() -> MonitoredPosition.unplanned(pos, LocalDateTime.now(clock)));
            var closedResult = executor.close(monitored, CloseReason.EMERGENCY);
            if (closedResult.isPresent()) {
                closed.add(closedResult.get());
                outcomes.add(outcome(pos, "closed"));
            } else {
                failed++;
                outcomes.add(outcome(pos, "failed"));
            }
        }

        double pips = closed.stream().mapToDouble(TradeResult::profitPips).sum();
        double amount = closed.stream().mapToDouble(TradeResult::profitAmount).sum();
        result.put("positions", outcomes);
        result.put("closed", closed.size());
        result.put("failed", failed);
        result.put("success", failed == 0);

        if (positions.isEmpty()) {
            logger.info("No open positions to close.");
            notifier.send("ℹ️ " + reason + ": no open positions");
        } else {
            logger.warn("🧯 {}: closed {}/{} positions, {} pips", reason, closed.size(), positions.size(), pips);
            notifier.send(String.format("🧯 %s: closed %d/%d position(s), %+.1f pips, %+,.0f%s",
                reason, closed.size(), positions.size(), pips, amount,
                failed > 0 ? String.format("%n🚨 %d position(s) could not be closed, check manually", failed) : ""));
        }
        return result;
    }

    private static Map<String, Object> outcome(Position pos, String status) {
        return Map.of(
            "positionId", pos.positionId(),
            "symbol", pos.symbol(),
            "side", pos.side().name(),
            "size", pos.size(),
            "status", status
        );
    }

    /**
     * Re-arm the one-shot trigger.
     */
    public void reset() {
        boolean wasTriggered = triggered.getAndSet(false);
        logger.warn("🔄 Emergency Protocol RESET (was triggered: {})", wasTriggered);
    }

    public boolean isTriggered() {
        return triggered.get();
    }

    public Map<String, Object> getLastExecutionResult() {
        return lastExecutionResult;
    }
}
