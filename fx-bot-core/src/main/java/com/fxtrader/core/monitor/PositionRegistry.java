package com.fxtrader.core.monitor;

import com.fxtrader.core.model.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Positions under monitoring plus the close claims for every exchange position.
 *
 * A close path must win {@link #tryClaim} before sending a close order. Claims cover tracked
 * and untracked positions alike, so two paths can never close the same position.
 */
public class PositionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PositionRegistry.class);

    private final Map<Long, MonitoredPosition> tracked = new ConcurrentHashMap<>();
    private final Map<Long, CloseReason> claims = new ConcurrentHashMap<>();

    public void register(MonitoredPosition position) {
        tracked.put(position.positionId(), position);
        logger.info("👀 Monitoring position {} ({} {} x{})",
            position.positionId(), position.side(), position.symbol(), position.size());
    }

    public void unregister(long positionId) {
        tracked.remove(positionId);
        claims.remove(positionId);
    }

    public Optional<MonitoredPosition> get(long positionId) {
        return Optional.ofNullable(tracked.get(positionId));
    }

    public boolean isTracked(long positionId) {
        return tracked.containsKey(positionId);
    }

    public List<MonitoredPosition> all() {
        return List.copyOf(tracked.values());
    }

    public Set<String> symbols() {
        return tracked.values().stream().map(MonitoredPosition::symbol).collect(Collectors.toSet());
    }

    public int size() {
        return tracked.size();
    }

    /**
     * @return true if the caller now owns the close of this position
     */
    public boolean tryClaim(long positionId, CloseReason reason) {
        CloseReason existing = claims.putIfAbsent(positionId, reason);
        if (existing != null) {
            logger.debug("Position {} already being closed by {}, {} skipped", positionId, existing, reason);
            return false;
        }
        return true;
    }

    /**
     * Give up a claim after a failed close so another path can try again.
     */
    public void releaseClaim(long positionId) {
        claims.remove(positionId);
    }

    public Optional<CloseReason> claimOf(long positionId) {
        return Optional.ofNullable(claims.get(positionId));
    }
}
