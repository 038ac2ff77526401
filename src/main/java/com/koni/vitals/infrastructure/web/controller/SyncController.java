package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.service.SiteRegistry;
import com.koni.vitals.application.service.SyncWindowService;
import com.koni.vitals.application.sync.SyncOrchestrator;
import com.koni.vitals.domain.event.SyncWindowRequested;
import com.koni.vitals.domain.model.SyncRunResult;
import com.koni.vitals.infrastructure.web.dto.SyncStatusResponse;
import com.koni.vitals.infrastructure.web.dto.SyncWindowRequest;
import com.koni.vitals.infrastructure.web.dto.WorkerHealthResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for the incremental sync worker.
 *
 * Endpoints:
 * - GET /api/v1/sync/health: worker liveness and effective settings
 * - GET /api/v1/sync/status: last run and per-site freshness
 * - POST /api/v1/sync/trigger: run one sync invocation now
 * - POST /api/v1/sync/windows: enqueue an explicit window fetch
 * - DELETE /api/v1/sync/state/{site}: forget a site's sync position
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
@Slf4j
public class SyncController {
    
    private final SyncOrchestrator syncOrchestrator;
    private final SyncWindowService syncWindowService;
    private final SiteRegistry siteRegistry;
    
    @GetMapping("/health")
    public ResponseEntity<WorkerHealthResponse> health() {
        return ResponseEntity.ok(WorkerHealthResponse.healthy(syncOrchestrator.name(), syncOrchestrator.describe()));
    }
    
    /**
     * The status reports the last finished run; a run in progress is not visible here.
     */
    @GetMapping("/status")
    public ResponseEntity<SyncStatusResponse> status() {
        Optional<SyncRunResult> lastRun = syncOrchestrator.lastRun();
        List<String> errors = lastRun.map(SyncRunResult::getErrors).orElse(List.of());
        String status = lastRun.map(SyncRunResult::getStatus).orElse("never_run");
        return ResponseEntity.ok(new SyncStatusResponse(status, lastRun.orElse(null),
                syncOrchestrator.siteStatuses(), errors));
    }
    
    /**
     * Runs one invocation synchronously. A run that found the lock held answers 200 with status
     * {@code skipped}; callers re-invoke while {@code continuation} is true.
     */
    @PostMapping("/trigger")
    public ResponseEntity<SyncRunResult> trigger() {
        log.info("Sync triggered via HTTP");
        return ResponseEntity.ok(syncOrchestrator.run());
    }
    
    /**
     * Example request:
     * POST /api/v1/sync/windows
     * {
     *   "site": "building-a",
     *   "start": "2025-01-31T10:00:00Z",
     *   "end": "2025-01-31T11:00:00Z",
     *   "pointNames": ["ahu1/sat"]
     * }
     *
     * @return 202 Accepted with the request id
     */
    @PostMapping("/windows")
    public ResponseEntity<Map<String, Object>> requestWindow(@RequestBody @Valid SyncWindowRequest request) {
        log.info("Sync window received: site={}, start={}, end={}", request.getSite(), request.getStart(),
                request.getEnd());
        SyncWindowRequested published = syncWindowService.request(request.getSite(), request.getStart(),
                request.getEnd(), request.getPointNames());
        return ResponseEntity.accepted().body(Map.of(
                "requestId", published.getRequestId().toString(),
                "site", published.getSite()));
    }
    
    @DeleteMapping("/state/{site}")
    public ResponseEntity<Void> resetSite(@PathVariable String site) {
        siteRegistry.requireKnown(site);
        syncOrchestrator.resetSite(site);
        return ResponseEntity.noContent().build();
    }
}
