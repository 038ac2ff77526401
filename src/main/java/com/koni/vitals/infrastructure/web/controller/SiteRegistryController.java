package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.service.SiteRegistry;
import com.koni.vitals.infrastructure.web.dto.SiteListRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the registry of sites the pipeline syncs.
 * Every mutation answers with the full list as stored afterwards.
 */
@RestController
@RequestMapping("/api/v1/sites")
@RequiredArgsConstructor
@Slf4j
public class SiteRegistryController {
    
    private final SiteRegistry siteRegistry;
    
    @GetMapping
    public ResponseEntity<Map<String, List<String>>> list() {
        return ResponseEntity.ok(Map.of("sites", siteRegistry.listSites()));
    }
    
    @PutMapping
    public ResponseEntity<Map<String, List<String>>> replace(@RequestBody @Valid SiteListRequest request) {
        log.info("Site list replaced via HTTP: count={}", request.getSites().size());
        return ResponseEntity.ok(Map.of("sites", siteRegistry.replace(request.getSites())));
    }
    
    @PostMapping("/{site}")
    public ResponseEntity<Map<String, List<String>>> add(@PathVariable String site) {
        return ResponseEntity.ok(Map.of("sites", siteRegistry.add(site)));
    }
    
    @DeleteMapping("/{site}")
    public ResponseEntity<Map<String, List<String>>> remove(@PathVariable String site) {
        return ResponseEntity.ok(Map.of("sites", siteRegistry.remove(site)));
    }
}
