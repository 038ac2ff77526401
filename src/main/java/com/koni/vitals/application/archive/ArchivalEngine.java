package com.koni.vitals.application.archive;

import com.koni.vitals.application.port.ColdObjectStore;
import com.koni.vitals.application.port.PartitionEncoder;
import com.koni.vitals.application.service.PipelineWorker;
import com.koni.vitals.application.service.SiteRegistry;
import com.koni.vitals.domain.exception.ArchiveVerificationException;
import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.model.ArchivePartition;
import com.koni.vitals.domain.model.ArchiveRunStats;
import com.koni.vitals.domain.model.Sample;
import com.koni.vitals.domain.model.StoredObject;
import com.koni.vitals.domain.repository.HotSampleRepository;
import com.koni.vitals.domain.repository.StateStore;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import com.koni.vitals.infrastructure.observability.PipelineMetrics;
import io.github.resilience4j.retry.Retry;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Moves aged samples from the hot store to date-partitioned cold storage.
 *
 * For every (site, point, UTC day) older than the retention period the engine reads the rows,
 * encodes them, uploads the object, verifies that it exists with a non-zero size, and only then
 * deletes the rows from the hot store. A failure at any step before verification leaves the hot
 * store untouched and the partition is retried on the next run.
 */
@Slf4j
@Service
public class ArchivalEngine implements PipelineWorker<ArchiveRunStats> {
    
    private final HotSampleRepository hotSamples;
    private final ColdObjectStore coldStore;
    private final PartitionEncoder encoder;
    private final StateStore stateStore;
    private final SiteRegistry siteRegistry;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Retry uploadRetry;
    private final PipelineProperties.Archive archive;
    
    public ArchivalEngine(HotSampleRepository hotSamples, ColdObjectStore coldStore, PartitionEncoder encoder,
                          StateStore stateStore, SiteRegistry siteRegistry, PipelineMetrics metrics, Clock clock,
                          @Qualifier("coldUploadRetry") Retry coldUploadRetry, PipelineProperties properties) {
        this.hotSamples = hotSamples;
        this.coldStore = coldStore;
        this.encoder = encoder;
        this.stateStore = stateStore;
        this.siteRegistry = siteRegistry;
        this.metrics = metrics;
        this.clock = clock;
        this.uploadRetry = coldUploadRetry;
        this.archive = properties.getArchive();
    }
    
    @Override
    public String name() {
        return "archive";
    }
    
    @Override
    @Observed(name = "archive.run", contextualName = "archive-run")
    public ArchiveRunStats run() {
        return metrics.recordArchiveRun(this::execute);
    }
    
    private ArchiveRunStats execute() {
        Instant started = clock.instant();
        ArchiveRunStats stats = new ArchiveRunStats("archive-" + started.toEpochMilli(), started);
        LocalDate cutoffDay = cutoffDay(started);
        log.info("Archival run started: runId={}, cutoffDay={}", stats.getRunId(), cutoffDay);
        
        for (String site : siteRegistry.listSites()) {
            try {
                archiveSite(site, cutoffDay, stats);
                stats.setSitesProcessed(stats.getSitesProcessed() + 1);
            } catch (StateStoreUnavailableException e) {
                log.error("Archival run aborted, state store unavailable: runId={}", stats.getRunId(), e);
                throw e;
            } catch (RuntimeException e) {
                log.warn("Archival failed for site: site={}, error={}", site, e.getMessage(), e);
                stats.siteFailed(site, e.getMessage());
            }
        }
        
        stats.finish(clock.instant());
        stateStore.saveArchiveRun(stats);
        log.info("Archival run finished: runId={}, considered={}, archived={}, skipped={}, failed={}, "
                        + "recordsArchived={}, recordsDeleted={}, durationMs={}",
                stats.getRunId(), stats.getPartitionsConsidered(), stats.getPartitionsArchived(),
                stats.getPartitionsSkipped(), stats.getPartitionsFailed(), stats.getRecordsArchived(),
                stats.getRecordsDeleted(), stats.getDurationMillis());
        return stats;
    }
    
    /**
     * First UTC day that is still inside the retention period; only earlier days are archived.
     */
    LocalDate cutoffDay(Instant now) {
        return now.atZone(ZoneOffset.UTC).toLocalDate().minusDays(archive.getRetentionDays());
    }
    
    private void archiveSite(String site, LocalDate cutoffDay, ArchiveRunStats stats) {
        long cutoffMillis = cutoffDay.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        for (String pointName : hotSamples.findPointNamesBefore(site, cutoffMillis)) {
            Optional<Long> earliest = hotSamples.findEarliestTimestamp(site, pointName, cutoffMillis);
            if (earliest.isEmpty()) {
                continue;
            }
            LocalDate day = Instant.ofEpochMilli(earliest.get()).atZone(ZoneOffset.UTC).toLocalDate();
            for (; day.isBefore(cutoffDay); day = day.plusDays(1)) {
                ArchivePartition partition = new ArchivePartition(site, pointName, day);
                if (hotSamples.countInRange(site, pointName, partition.startMillis(),
                        partition.endMillisExclusive()) == 0) {
                    continue;
                }
                stats.setPartitionsConsidered(stats.getPartitionsConsidered() + 1);
                archivePartition(partition, stats);
            }
        }
    }
    
    void archivePartition(ArchivePartition partition, ArchiveRunStats stats) {
        String key = partition.objectKey(encoder.extension());
        try {
            if (coldStore.exists(key)) {
                log.warn("Partition already in cold storage but hot rows remain, skipping: key={}", key);
                stats.setPartitionsSkipped(stats.getPartitionsSkipped() + 1);
                return;
            }
            
            List<Sample> rows = readPartition(partition);
            if (rows.isEmpty()) {
                return;
            }
            byte[] content = encoder.encode(partition, rows);
            
            uploadRetry.executeRunnable(() -> coldStore.put(key, content, encoder.contentType()));
            
            StoredObject stored = coldStore.stat(key)
                    .filter(object -> object.getSize() > 0)
                    .orElseThrow(() -> new ArchiveVerificationException(
                            "Uploaded object missing or empty: " + key));
            
            int deleted = hotSamples.deleteRange(partition.getSite(), partition.getPointName(),
                    partition.startMillis(), partition.endMillisExclusive());
            if (deleted != rows.size()) {
                log.warn("Deleted row count differs from archived row count: key={}, archived={}, deleted={}",
                        key, rows.size(), deleted);
            }
            
            stats.partitionArchived(rows.size(), deleted);
            metrics.recordPartitionArchived(deleted);
            log.info("Partition archived: key={}, rows={}, bytes={}, deleted={}",
                    key, rows.size(), stored.getSize(), deleted);
        } catch (StateStoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Partition archival failed, hot rows kept: key={}, error={}", key, e.getMessage());
            stats.partitionFailed(partition, e.getMessage());
            metrics.recordPartitionFailed();
        }
    }
    
    /**
     * Reads all rows of a partition in keyset pages of {@code vitals.archive.batch-size}.
     */
    private List<Sample> readPartition(ArchivePartition partition) {
        List<Sample> rows = new ArrayList<>();
        long after = partition.startMillis() - 1;
        while (true) {
            List<Sample> page = hotSamples.findPage(partition.getSite(), partition.getPointName(),
                    partition.startMillis(), partition.endMillisExclusive(), after, archive.getBatchSize());
            rows.addAll(page);
            if (page.size() < archive.getBatchSize()) {
                return rows;
            }
            after = page.get(page.size() - 1).getTimestamp();
        }
    }
    
    public Optional<ArchiveRunStats> lastRun() {
        return stateStore.findLastArchiveRun();
    }
    
    @Override
    public Map<String, Object> describe() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("retentionDays", archive.getRetentionDays());
        config.put("batchSize", archive.getBatchSize());
        config.put("uploadAttempts", archive.getUploadAttempts());
        config.put("uploadBackoffMillis", archive.getUploadBackoff().toMillis());
        config.put("format", encoder.extension());
        return config;
    }
}
