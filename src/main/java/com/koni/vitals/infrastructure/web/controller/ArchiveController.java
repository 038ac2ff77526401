package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.archive.ArchivalEngine;
import com.koni.vitals.domain.model.ArchiveRunStats;
import com.koni.vitals.infrastructure.web.dto.WorkerHealthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the hot-to-cold archival worker.
 */
@RestController
@RequestMapping("/api/v1/archive")
@RequiredArgsConstructor
@Slf4j
public class ArchiveController {
    
    private final ArchivalEngine archivalEngine;
    
    @GetMapping("/health")
    public ResponseEntity<WorkerHealthResponse> health() {
        return ResponseEntity.ok(WorkerHealthResponse.healthy(archivalEngine.name(), archivalEngine.describe()));
    }
    
    /**
     * @return the statistics of the last finished run, or 204 when archival never ran
     */
    @GetMapping("/status")
    public ResponseEntity<ArchiveRunStats> status() {
        return archivalEngine.lastRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
    
    @PostMapping("/trigger")
    public ResponseEntity<ArchiveRunStats> trigger() {
        log.info("Archival triggered via HTTP");
        return ResponseEntity.ok(archivalEngine.run());
    }
}
