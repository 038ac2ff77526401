package com.koni.vitals.application.sync;

import com.koni.vitals.application.service.FreshnessMonitor;
import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.model.SiteSyncResult;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Runs extra sync cycles for a site that is still behind after its first cycle.
 *
 * The loop stops at the first of: lag at or below the target, the cycle cap, the wall-clock
 * budget or deadline, a cycle that does not move the sync position, or a cycle error.
 */
@Slf4j
@Component
public class CatchUpLoop {
    
    private final SiteSyncService siteSync;
    private final FreshnessMonitor freshness;
    private final Clock clock;
    private final PipelineProperties.Sync sync;
    
    public CatchUpLoop(SiteSyncService siteSync, FreshnessMonitor freshness, Clock clock,
                       PipelineProperties properties) {
        this.siteSync = siteSync;
        this.freshness = freshness;
        this.clock = clock;
        this.sync = properties.getSync();
    }
    
    /**
     * @param result the site result the extra cycles are added to
     * @param deadline the latest instant a new cycle may start, in addition to the loop's own budget
     * @return the number of extra cycles run
     */
    public int run(String site, SiteSyncResult result, Instant deadline) {
        Instant started = clock.instant();
        Instant budgetEnd = started.plus(sync.getCatchUpBudget());
        Instant stopAt = budgetEnd.isBefore(deadline) ? budgetEnd : deadline;
        int cycles = 0;
        
        while (cycles < sync.getMaxCatchUpCycles()) {
            Instant now = clock.instant();
            if (!now.isBefore(stopAt)) {
                log.info("Catch-up budget exhausted: site={}, cycles={}", site, cycles);
                break;
            }
            Optional<Duration> age = freshness.dataAge(site, now);
            if (freshness.isWithinTargetLag(age)) {
                log.debug("Site caught up: site={}, ageSeconds={}", site, age.get().getSeconds());
                break;
            }
            
            SyncCycleResult cycle;
            try {
                cycle = siteSync.syncOnce(site);
            } catch (StateStoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Catch-up cycle failed, stopping: site={}, cycle={}, error={}",
                        site, cycles + 1, e.getMessage());
                result.setError(e.getMessage());
                break;
            }
            cycles++;
            result.addCycle(cycle.getSamplesWritten(), cycle.getSamplesDropped());
            result.setLastSyncTimestamp(cycle.getLastSyncTimestamp());
            
            if (!cycle.isAdvanced() && !cycle.isEmptyWindowSkipped()) {
                log.debug("Catch-up cycle made no progress, stopping: site={}, window={}", site, cycle.getWindow());
                break;
            }
        }
        
        if (cycles > 0) {
            log.info("Catch-up finished: site={}, extraCycles={}, durationMs={}",
                    site, cycles, Duration.between(started, clock.instant()).toMillis());
        }
        return cycles;
    }
}
