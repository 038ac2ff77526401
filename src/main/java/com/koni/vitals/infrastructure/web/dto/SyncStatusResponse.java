package com.koni.vitals.infrastructure.web.dto;

import com.koni.vitals.application.sync.SiteStatus;
import com.koni.vitals.domain.model.SyncRunResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Response of {@code GET /api/v1/sync/status}.
 * {@code lastRun} is null until the first run has finished.
 */
@Getter
@AllArgsConstructor
public class SyncStatusResponse {
    
    private final String status;
    private final SyncRunResult lastRun;
    private final List<SiteStatus> sites;
    private final List<String> errors;
}
