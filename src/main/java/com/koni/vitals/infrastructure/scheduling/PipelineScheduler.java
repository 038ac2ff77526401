package com.koni.vitals.infrastructure.scheduling;

import com.koni.vitals.application.archive.ArchivalEngine;
import com.koni.vitals.application.backfill.BackfillEngine;
import com.koni.vitals.application.backfill.BackfillResult;
import com.koni.vitals.application.sync.SyncOrchestrator;
import com.koni.vitals.domain.model.ArchiveRunStats;
import com.koni.vitals.domain.model.SyncRunResult;
import com.koni.vitals.domain.repository.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cron entry points of the three workers and the state table cleanup.
 *
 * Each method calls the same handler as the matching HTTP trigger. Overlapping invocations
 * are resolved by the workers' run locks, not here. Disabled with
 * {@code vitals.scheduling.enabled=false}.
 */
@Slf4j
@Component
@EnableScheduling
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "vitals.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineScheduler {
    
    private final SyncOrchestrator syncOrchestrator;
    private final BackfillEngine backfillEngine;
    private final ArchivalEngine archivalEngine;
    private final KeyValueStore keyValueStore;
    
    @Scheduled(cron = "${vitals.scheduling.sync-cron:0 * * * * *}", zone = "UTC")
    public void sync() {
        try {
            SyncRunResult result = syncOrchestrator.run();
            log.info("Scheduled sync finished: syncId={}, status={}, continuation={}",
                    result.getSyncId(), result.getStatus(), result.isContinuation());
        } catch (RuntimeException e) {
            log.error("Scheduled sync aborted: error={}", e.getMessage(), e);
        }
    }
    
    @Scheduled(cron = "${vitals.scheduling.backfill-cron:30 */5 * * * *}", zone = "UTC")
    public void backfill() {
        try {
            List<BackfillResult> results = backfillEngine.run();
            log.info("Scheduled backfill finished: sites={}", results.size());
        } catch (RuntimeException e) {
            log.error("Scheduled backfill aborted: error={}", e.getMessage(), e);
        }
    }
    
    @Scheduled(cron = "${vitals.scheduling.archive-cron:0 0 2 * * *}", zone = "UTC")
    public void archive() {
        try {
            ArchiveRunStats stats = archivalEngine.run();
            log.info("Scheduled archival finished: runId={}, partitionsArchived={}, partitionsFailed={}",
                    stats.getRunId(), stats.getPartitionsArchived(), stats.getPartitionsFailed());
        } catch (RuntimeException e) {
            log.error("Scheduled archival aborted: error={}", e.getMessage(), e);
        }
    }
    
    @Scheduled(cron = "${vitals.scheduling.purge-cron:0 30 3 * * *}", zone = "UTC")
    public void purgeExpiredState() {
        try {
            int removed = keyValueStore.purgeExpired();
            log.info("Expired state entries purged: removed={}", removed);
        } catch (RuntimeException e) {
            log.error("State purge failed: error={}", e.getMessage(), e);
        }
    }
}
