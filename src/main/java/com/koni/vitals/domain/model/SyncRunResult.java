package com.koni.vitals.domain.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one sync orchestrator invocation.
 * Status is {@code success}, {@code partial} when some sites failed, {@code error} when all
 * selected sites failed, or {@code skipped} when the run lock was held.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString
public class SyncRunResult {
    
    public static final String SUCCESS = "success";
    public static final String PARTIAL = "partial";
    public static final String ERROR = "error";
    public static final String SKIPPED = "skipped";
    
    private String syncId;
    private String status;
    private boolean lockAcquired;
    private boolean continuation;
    private boolean refillPerformed;
    private Instant startedAt;
    private Instant finishedAt;
    private List<SiteSyncResult> sites = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
    
    public SyncRunResult(String syncId, Instant startedAt) {
        this.syncId = syncId;
        this.startedAt = startedAt;
        this.lockAcquired = true;
    }
    
    public static SyncRunResult lockHeld(String syncId, Instant now) {
        SyncRunResult result = new SyncRunResult(syncId, now);
        result.setLockAcquired(false);
        result.setStatus(SKIPPED);
        result.setFinishedAt(now);
        return result;
    }
    
    public void addSite(SiteSyncResult siteResult) {
        sites.add(siteResult);
        if (siteResult.isFailed()) {
            errors.add(siteResult.getSite() + ": " + siteResult.getError());
        }
    }
    
    /**
     * Derives the run status from the per-site outcomes.
     */
    public void finish(Instant now) {
        this.finishedAt = now;
        long failed = sites.stream().filter(SiteSyncResult::isFailed).count();
        if (failed == 0) {
            this.status = SUCCESS;
        } else if (failed == sites.size()) {
            this.status = ERROR;
        } else {
            this.status = PARTIAL;
        }
    }
}
