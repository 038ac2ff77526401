package com.koni.vitals.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Outcome of syncing one site within one orchestrator run.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString
public class SiteSyncResult {
    
    public static final String SYNCED = "synced";
    public static final String SKIPPED_FRESH = "skipped_fresh";
    public static final String SKIPPED_BUDGET = "skipped_budget";
    public static final String FAILED = "failed";
    
    private String site;
    private String outcome;
    private int cyclesRun;
    private long samplesWritten;
    private long samplesDropped;
    private Long lastSyncTimestamp;
    private Long dataAgeSeconds;
    private String error;
    
    public SiteSyncResult(String site) {
        this.site = site;
        this.outcome = SYNCED;
    }
    
    public static SiteSyncResult skipped(String site, String reason, Long dataAgeSeconds) {
        SiteSyncResult result = new SiteSyncResult(site);
        result.setOutcome(reason);
        result.setDataAgeSeconds(dataAgeSeconds);
        return result;
    }
    
    public void addCycle(long written, long dropped) {
        this.cyclesRun++;
        this.samplesWritten += written;
        this.samplesDropped += dropped;
    }
    
    public void fail(String message) {
        this.outcome = FAILED;
        this.error = message;
    }
    
    @JsonIgnore
    public boolean isFailed() {
        return FAILED.equals(outcome);
    }
}
