package com.koni.vitals.application.sync;

import com.koni.vitals.domain.model.SyncState;
import com.koni.vitals.domain.model.TimeWindow;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Computes the time window of the next incremental sync cycle of a site.
 *
 * <ul>
 *   <li>No state, or a state older than the stale threshold: {@code [now - firstSyncWindow, now]}.</li>
 *   <li>Otherwise: {@code [base - lookback, now]}, capped to {@code maxWindow} by pulling the
 *       end back, so a long outage is caught up oldest first over several cycles. The base is the
 *       sync position, or the scan position when an empty window has already been read past it.</li>
 * </ul>
 */
@Component
public class SyncWindowPolicy {
    
    private final PipelineProperties.Sync sync;
    
    public SyncWindowPolicy(PipelineProperties properties) {
        this.sync = properties.getSync();
    }
    
    public boolean isFirstSync(Optional<SyncState> state, Instant now) {
        return state.isEmpty() || state.get().isOlderThan(sync.getStaleStateThreshold(), now);
    }
    
    public TimeWindow nextWindow(Optional<SyncState> state, OptionalLong scanPosition, Instant now) {
        if (isFirstSync(state, now)) {
            return new TimeWindow(now.minus(sync.getFirstSyncWindow()), now);
        }
        Instant base = state.get().lastSyncInstant();
        if (scanPosition.isPresent() && scanPosition.getAsLong() > base.toEpochMilli()) {
            base = Instant.ofEpochMilli(scanPosition.getAsLong());
        }
        Instant start = base.minus(sync.getLookback());
        if (start.isAfter(now)) {
            start = now.minus(sync.getLookback());
        }
        return new TimeWindow(start, now).capTo(sync.getMaxWindow());
    }
    
    /**
     * Window re-fetched by the hourly refill to pick up late-arriving samples.
     */
    public TimeWindow refillWindow(Instant now) {
        return new TimeWindow(now.minus(sync.getRefillWindow()), now);
    }
}
