package com.koni.vitals.application.sync;

import com.koni.vitals.domain.model.SyncState;
import com.koni.vitals.domain.model.TimeWindow;
import com.koni.vitals.domain.repository.HotSampleRepository;
import com.koni.vitals.domain.repository.StateStore;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import com.koni.vitals.infrastructure.observability.PipelineMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Runs sync cycles for a single site: fetch a window, upsert it, advance the sync position.
 *
 * The position advances to the newest timestamp actually written, never to wall-clock time or
 * to a window bound. A cycle that writes nothing newer leaves it unchanged. When such a cycle
 * read a window cut short by the maximum window length completely, only the separate scan
 * position moves to the window end, so the next cycle reads past an upstream gap.
 */
@Slf4j
@Service
public class SiteSyncService {
    
    private final WindowFetcher fetcher;
    private final HotSampleRepository hotSamples;
    private final StateStore stateStore;
    private final SyncWindowPolicy windowPolicy;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final List<String> pointNames;
    
    public SiteSyncService(WindowFetcher fetcher, HotSampleRepository hotSamples, StateStore stateStore,
                           SyncWindowPolicy windowPolicy, PipelineMetrics metrics, Clock clock,
                           PipelineProperties properties) {
        this.fetcher = fetcher;
        this.hotSamples = hotSamples;
        this.stateStore = stateStore;
        this.windowPolicy = windowPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.pointNames = properties.getSync().getPointNames();
    }
    
    @Observed(name = "sync.cycle", contextualName = "site-sync-cycle")
    public SyncCycleResult syncOnce(String site) {
        Instant now = clock.instant();
        Optional<SyncState> state = stateStore.findSyncState(site);
        TimeWindow window = windowPolicy.nextWindow(state, stateStore.findScanPosition(site), now);
        boolean capped = state.isPresent() && window.getEnd().isBefore(now);
        Long previous = state.map(SyncState::getLastSyncTimestamp).orElse(null);
        
        FetchResult fetched = fetcher.fetch(site, window, pointNames);
        int written = hotSamples.upsertAll(fetched.getSamples());
        metrics.recordSyncCycle();
        metrics.recordSamplesWritten(written);
        metrics.recordSamplesDropped(fetched.getDroppedCount());
        
        Optional<SyncState> next = advance(site, state, fetched, now);
        next.ifPresent(stateStore::saveSyncState);
        Long lastSync = next.or(() -> state).map(SyncState::getLastSyncTimestamp).orElse(null);
        
        boolean emptyWindowSkipped = next.isEmpty() && capped && !fetched.isTruncated();
        if (emptyWindowSkipped) {
            stateStore.saveScanPosition(site, window.getEnd().toEpochMilli());
            log.info("No new samples in capped window, scanning past it: site={}, window={}, lastSync={}",
                    site, window, lastSync);
        }
        
        log.info("Sync cycle complete: site={}, window={}, written={}, dropped={}, pages={}, lastSync={}",
                site, window, written, fetched.getDroppedCount(), fetched.getPagesFetched(), lastSync);
        return new SyncCycleResult(site, window, written, fetched.getDroppedCount(), previous, lastSync,
                emptyWindowSkipped);
    }
    
    /**
     * Re-fetches the refill window to pick up late samples. Only moves the position forward.
     */
    @Observed(name = "sync.refill", contextualName = "site-sync-refill")
    public SyncCycleResult refill(String site) {
        Instant now = clock.instant();
        TimeWindow window = windowPolicy.refillWindow(now);
        Optional<SyncState> state = stateStore.findSyncState(site);
        Long previous = state.map(SyncState::getLastSyncTimestamp).orElse(null);
        
        FetchResult fetched = fetcher.fetch(site, window, pointNames);
        int written = hotSamples.upsertAll(fetched.getSamples());
        metrics.recordSamplesWritten(written);
        metrics.recordSamplesDropped(fetched.getDroppedCount());
        
        Optional<SyncState> next = advance(site, state, fetched, now);
        next.ifPresent(stateStore::saveSyncState);
        Long lastSync = next.or(() -> state).map(SyncState::getLastSyncTimestamp).orElse(null);
        
        log.info("Refill complete: site={}, window={}, written={}", site, window, written);
        return new SyncCycleResult(site, window, written, fetched.getDroppedCount(), previous, lastSync);
    }
    
    /**
     * @return the state to save, or empty when the position does not change
     */
    private Optional<SyncState> advance(String site, Optional<SyncState> state, FetchResult fetched, Instant now) {
        OptionalLong maxWritten = fetched.maxTimestamp();
        long current = state.map(SyncState::getLastSyncTimestamp).orElse(Long.MIN_VALUE);
        if (maxWritten.isEmpty() || maxWritten.getAsLong() <= current) {
            return Optional.empty();
        }
        long target = maxWritten.getAsLong();
        if (state.isEmpty()) {
            return Optional.of(SyncState.initial(site, target, now));
        }
        return Optional.of(state.get().advanceTo(target, now));
    }
}
