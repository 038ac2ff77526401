package com.koni.vitals.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking pipeline metrics.
 * Provides counters and timers for the sync, backfill and archival workers.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final Counter samplesWritten;
    private final Counter samplesDropped;
    private final Counter apiPagesFetched;
    private final Counter syncCycles;
    private final Counter syncLockSkipped;
    private final Counter siteFailures;
    private final Counter backfillPages;
    private final Counter partitionsArchived;
    private final Counter partitionsFailed;
    private final Counter recordsDeleted;
    private final Counter dlqMessagesSent;
    private final Timer syncRunTime;
    private final Timer archiveRunTime;

    public PipelineMetrics(MeterRegistry registry) {
        this.samplesWritten = Counter.builder("vitals.samples.written.total")
                .description("Samples upserted into the hot store")
                .register(registry);

        this.samplesDropped = Counter.builder("vitals.samples.dropped.total")
                .description("Samples dropped for null, NaN or non-numeric values")
                .register(registry);

        this.apiPagesFetched = Counter.builder("vitals.api.pages.total")
                .description("Pages fetched from the upstream time series API")
                .register(registry);

        this.syncCycles = Counter.builder("vitals.sync.cycles.total")
                .description("Sync cycles run across all sites")
                .register(registry);

        this.syncLockSkipped = Counter.builder("vitals.sync.lock_skipped.total")
                .description("Sync runs skipped because the run lock was held")
                .register(registry);

        this.siteFailures = Counter.builder("vitals.sync.site_failures.total")
                .description("Per-site sync failures")
                .register(registry);

        this.backfillPages = Counter.builder("vitals.backfill.pages.total")
                .description("Backfill pages processed")
                .register(registry);

        this.partitionsArchived = Counter.builder("vitals.archive.partitions.total")
                .description("Partitions archived to cold storage")
                .tag("outcome", "archived")
                .register(registry);

        this.partitionsFailed = Counter.builder("vitals.archive.partitions.total")
                .description("Partitions archived to cold storage")
                .tag("outcome", "failed")
                .register(registry);

        this.recordsDeleted = Counter.builder("vitals.archive.records_deleted.total")
                .description("Hot store rows deleted after verified archival")
                .register(registry);

        this.dlqMessagesSent = Counter.builder("vitals.queue.dlq.sent.total")
                .description("Sync window requests sent to the Dead Letter Queue")
                .register(registry);

        this.syncRunTime = Timer.builder("vitals.sync.run.time")
                .description("Duration of a sync orchestrator run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.archiveRunTime = Timer.builder("vitals.archive.run.time")
                .description("Duration of an archival run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordSamplesWritten(long count) {
        samplesWritten.increment(count);
    }

    public void recordSamplesDropped(long count) {
        if (count > 0) {
            samplesDropped.increment(count);
            log.debug("Dropped samples counter incremented by {}", count);
        }
    }

    public void recordApiPage() {
        apiPagesFetched.increment();
    }

    public void recordSyncCycle() {
        syncCycles.increment();
    }

    public void recordLockSkipped() {
        syncLockSkipped.increment();
        log.debug("Sync lock skipped counter incremented");
    }

    public void recordSiteFailure() {
        siteFailures.increment();
    }

    public void recordBackfillPage() {
        backfillPages.increment();
    }

    public void recordPartitionArchived(long deleted) {
        partitionsArchived.increment();
        recordsDeleted.increment(deleted);
    }

    public void recordPartitionFailed() {
        partitionsFailed.increment();
    }

    /**
     * Increment the counter for messages sent to Dead Letter Queue.
     */
    public void recordDlqMessageSent() {
        dlqMessagesSent.increment();
        log.debug("DLQ message sent counter incremented");
    }

    /**
     * Record the duration of a sync run.
     *
     * @param operation The run to time
     * @param <T> The return type of the run
     * @return The result of the run
     */
    public <T> T recordSyncRun(Supplier<T> operation) {
        return syncRunTime.record(operation);
    }

    public <T> T recordArchiveRun(Supplier<T> operation) {
        return archiveRunTime.record(operation);
    }
}
