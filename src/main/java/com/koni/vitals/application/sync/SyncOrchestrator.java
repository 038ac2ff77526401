package com.koni.vitals.application.sync;

import com.koni.vitals.application.port.RunLock;
import com.koni.vitals.application.service.FreshnessMonitor;
import com.koni.vitals.application.service.PipelineWorker;
import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.model.SiteSyncResult;
import com.koni.vitals.domain.model.SyncRunResult;
import com.koni.vitals.domain.model.SyncState;
import com.koni.vitals.domain.repository.StateStore;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import com.koni.vitals.infrastructure.observability.PipelineMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Entry point of the incremental sync.
 *
 * One run takes the shard's run lock, selects sites, and for each site runs one sync cycle
 * followed by the catch-up loop. A failing site is recorded and the run moves on; only a state
 * store outage aborts the run. The run lock is advisory, so overlapping runs are tolerated.
 */
@Slf4j
@Service
public class SyncOrchestrator implements PipelineWorker<SyncRunResult> {
    
    private final RunLock runLock;
    private final SiteSelector siteSelector;
    private final SiteSyncService siteSync;
    private final CatchUpLoop catchUpLoop;
    private final FreshnessMonitor freshness;
    private final StateStore stateStore;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final PipelineProperties.Sync sync;
    
    public SyncOrchestrator(RunLock runLock, SiteSelector siteSelector, SiteSyncService siteSync,
                            CatchUpLoop catchUpLoop, FreshnessMonitor freshness, StateStore stateStore,
                            PipelineMetrics metrics, Clock clock, PipelineProperties properties) {
        this.runLock = runLock;
        this.siteSelector = siteSelector;
        this.siteSync = siteSync;
        this.catchUpLoop = catchUpLoop;
        this.freshness = freshness;
        this.stateStore = stateStore;
        this.metrics = metrics;
        this.clock = clock;
        this.sync = properties.getSync();
    }
    
    @Override
    public String name() {
        return "sync";
    }
    
    @Override
    @Observed(name = "sync.run", contextualName = "sync-run")
    public SyncRunResult run() {
        return metrics.recordSyncRun(this::execute);
    }
    
    private SyncRunResult execute() {
        Instant started = clock.instant();
        String syncId = newSyncId(started);
        String scope = sync.lockScope();
        
        Optional<String> lease = runLock.acquire(scope, sync.effectiveLockTtl());
        if (lease.isEmpty()) {
            metrics.recordLockSkipped();
            log.info("Sync run skipped, lock held: syncId={}, scope={}", syncId, scope);
            return SyncRunResult.lockHeld(syncId, started);
        }
        
        try {
            SyncRunResult result = new SyncRunResult(syncId, started);
            Instant deadline = started.plus(sync.getInvocationBudget());
            boolean refill = sync.isRefillEnabled() && started.atZone(ZoneOffset.UTC).getMinute() == 0;
            result.setRefillPerformed(refill);
            
            List<String> sites = siteSelector.select(started);
            log.info("Sync run started: syncId={}, sites={}, refill={}", syncId, sites.size(), refill);
            
            List<SiteSyncResult> siteResults = sync.getSiteParallelism() > 1 && sites.size() > 1
                    ? syncParallel(sites, deadline, refill)
                    : syncSequential(sites, deadline, refill);
            siteResults.forEach(result::addSite);
            
            result.setContinuation(needsContinuation(siteResults));
            result.finish(clock.instant());
            stateStore.saveSyncRun(result);
            
            log.info("Sync run finished: syncId={}, status={}, sites={}, errors={}, continuation={}",
                    syncId, result.getStatus(), siteResults.size(), result.getErrors().size(),
                    result.isContinuation());
            return result;
        } catch (StateStoreUnavailableException e) {
            log.error("Sync run aborted, state store unavailable: syncId={}", syncId, e);
            throw e;
        } finally {
            runLock.release(scope, lease.get());
        }
    }
    
    private List<SiteSyncResult> syncSequential(List<String> sites, Instant deadline, boolean refill) {
        List<SiteSyncResult> results = new ArrayList<>();
        for (String site : sites) {
            results.add(syncSiteWithinBudget(site, deadline, refill));
        }
        return results;
    }
    
    private List<SiteSyncResult> syncParallel(List<String> sites, Instant deadline, boolean refill) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(sync.getSiteParallelism(), sites.size()));
        try {
            List<Future<SiteSyncResult>> futures = new ArrayList<>();
            for (String site : sites) {
                futures.add(executor.submit(() -> syncSiteWithinBudget(site, deadline, refill)));
            }
            List<SiteSyncResult> results = new ArrayList<>();
            for (Future<SiteSyncResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while syncing sites", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Site sync failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
    
    private SiteSyncResult syncSiteWithinBudget(String site, Instant deadline, boolean refill) {
        if (!clock.instant().isBefore(deadline)) {
            log.info("Invocation budget exhausted, site deferred: site={}", site);
            return SiteSyncResult.skipped(site, SiteSyncResult.SKIPPED_BUDGET, null);
        }
        return syncSite(site, deadline, refill);
    }
    
    /**
     * Syncs one site. Failures other than a state store outage end up in the result.
     */
    SiteSyncResult syncSite(String site, Instant deadline, boolean refill) {
        SiteSyncResult result = new SiteSyncResult(site);
        try {
            Optional<Duration> age = freshness.dataAge(site, clock.instant());
            boolean fresh = freshness.isFresh(age);
            if (fresh && !refill) {
                log.debug("Site fresh, skipping: site={}, ageSeconds={}", site, age.get().getSeconds());
                return SiteSyncResult.skipped(site, SiteSyncResult.SKIPPED_FRESH, age.get().getSeconds());
            }
            
            if (!fresh) {
                SyncCycleResult first = siteSync.syncOnce(site);
                result.addCycle(first.getSamplesWritten(), first.getSamplesDropped());
                result.setLastSyncTimestamp(first.getLastSyncTimestamp());
                catchUpLoop.run(site, result, deadline);
            }
            
            if (refill) {
                SyncCycleResult refilled = siteSync.refill(site);
                result.setSamplesWritten(result.getSamplesWritten() + refilled.getSamplesWritten());
                result.setSamplesDropped(result.getSamplesDropped() + refilled.getSamplesDropped());
                result.setLastSyncTimestamp(refilled.getLastSyncTimestamp());
            }
            
            result.setDataAgeSeconds(freshness.dataAge(site, clock.instant()).map(Duration::getSeconds).orElse(null));
        } catch (StateStoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Site sync failed: site={}, error={}", site, e.getMessage(), e);
            metrics.recordSiteFailure();
            result.fail(e.getMessage());
        }
        return result;
    }
    
    private boolean needsContinuation(List<SiteSyncResult> results) {
        for (SiteSyncResult result : results) {
            if (SiteSyncResult.SKIPPED_BUDGET.equals(result.getOutcome())) {
                return true;
            }
            if (SiteSyncResult.SYNCED.equals(result.getOutcome())
                    && (result.getDataAgeSeconds() == null
                        || result.getDataAgeSeconds() > sync.getTargetLag().getSeconds())) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * Sync position and freshness of every site in this shard.
     */
    public List<SiteStatus> siteStatuses() {
        Instant now = clock.instant();
        List<SiteStatus> statuses = new ArrayList<>();
        for (String site : siteSelector.shardSites()) {
            Optional<Duration> age = freshness.dataAge(site, now);
            Long lastSync = stateStore.findSyncState(site).map(SyncState::getLastSyncTimestamp).orElse(null);
            statuses.add(new SiteStatus(site, lastSync, age.map(Duration::getSeconds).orElse(null),
                    freshness.classify(age)));
        }
        return statuses;
    }
    
    public Optional<SyncRunResult> lastRun() {
        return stateStore.findLastSyncRun();
    }
    
    /**
     * Removes the sync position of a site; its next cycle is a first sync.
     */
    public void resetSite(String site) {
        stateStore.deleteSyncState(site);
        log.info("Sync state reset: site={}", site);
    }
    
    @Override
    public Map<String, Object> describe() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("lockScope", sync.lockScope());
        config.put("maxSitesPerRun", sync.getMaxSitesPerRun());
        config.put("urgentAgeSeconds", sync.getUrgentAge().getSeconds());
        config.put("skipIfFresherThanSeconds", sync.getSkipIfFresherThan().getSeconds());
        config.put("targetLagSeconds", sync.getTargetLag().getSeconds());
        config.put("maxCatchUpCycles", sync.getMaxCatchUpCycles());
        config.put("catchUpBudgetSeconds", sync.getCatchUpBudget().getSeconds());
        config.put("lookbackMinutes", sync.getLookback().toMinutes());
        config.put("maxWindowMinutes", sync.getMaxWindow().toMinutes());
        config.put("invocationBudgetSeconds", sync.getInvocationBudget().getSeconds());
        config.put("refillEnabled", sync.isRefillEnabled());
        config.put("siteParallelism", sync.getSiteParallelism());
        return config;
    }
    
    static String newSyncId(Instant now) {
        return "sync_" + now.toEpochMilli() + "_"
                + Long.toString(ThreadLocalRandom.current().nextLong(36L * 36 * 36 * 36 * 36 * 36), 36);
    }
}
