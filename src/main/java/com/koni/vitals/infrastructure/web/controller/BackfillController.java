package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.backfill.BackfillEngine;
import com.koni.vitals.application.backfill.BackfillResult;
import com.koni.vitals.infrastructure.web.dto.BackfillTriggerRequest;
import com.koni.vitals.infrastructure.web.dto.WorkerHealthResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the historical backfill worker.
 *
 * Each trigger processes at most the configured number of pages for one site and reports
 * whether more work remains through {@code continuation}.
 */
@RestController
@RequestMapping("/api/v1/backfill")
@RequiredArgsConstructor
@Slf4j
public class BackfillController {
    
    private final BackfillEngine backfillEngine;
    
    @GetMapping("/health")
    public ResponseEntity<WorkerHealthResponse> health() {
        return ResponseEntity.ok(WorkerHealthResponse.healthy(backfillEngine.name(), backfillEngine.describe()));
    }
    
    @GetMapping("/status")
    public ResponseEntity<BackfillResult> status(@RequestParam("site") String site) {
        return ResponseEntity.ok(backfillEngine.status(site));
    }
    
    @PostMapping("/trigger")
    public ResponseEntity<BackfillResult> trigger(@RequestBody @Valid BackfillTriggerRequest request) {
        log.info("Backfill triggered via HTTP: site={}, reset={}", request.getSite(), request.isReset());
        return ResponseEntity.ok(backfillEngine.trigger(request.getSite(), request.isReset()));
    }
}
