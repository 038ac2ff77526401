package com.koni.vitals.domain.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Counters and error log of one archival run.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString
public class ArchiveRunStats {
    
    private String runId;
    private Instant startedAt;
    private Instant finishedAt;
    private long durationMillis;
    private int sitesProcessed;
    private int partitionsConsidered;
    private int partitionsArchived;
    private int partitionsSkipped;
    private int partitionsFailed;
    private long recordsArchived;
    private long recordsDeleted;
    private int filesCreated;
    private List<String> errors = new ArrayList<>();
    
    public ArchiveRunStats(String runId, Instant startedAt) {
        this.runId = runId;
        this.startedAt = startedAt;
    }
    
    public void partitionArchived(long archived, long deleted) {
        partitionsArchived++;
        filesCreated++;
        recordsArchived += archived;
        recordsDeleted += deleted;
    }
    
    public void partitionFailed(ArchivePartition partition, String message) {
        partitionsFailed++;
        errors.add(partition.getSite() + "/" + partition.getPointName() + "/" + partition.getDay() + ": " + message);
    }
    
    public void siteFailed(String site, String message) {
        errors.add(site + ": " + message);
    }
    
    public void finish(Instant now) {
        this.finishedAt = now;
        this.durationMillis = Duration.between(startedAt, now).toMillis();
    }
}
