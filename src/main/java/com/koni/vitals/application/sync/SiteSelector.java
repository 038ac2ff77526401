package com.koni.vitals.application.sync;

import com.koni.vitals.application.service.FreshnessMonitor;
import com.koni.vitals.application.service.SiteRegistry;
import com.koni.vitals.domain.repository.StateStore;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the sites of one sync run.
 *
 * Only sites of this deployment's shard are considered. Urgent sites come first, oldest data
 * first; the remaining slots are filled round-robin from a persisted cursor so every site is
 * eventually picked.
 */
@Slf4j
@Component
public class SiteSelector {
    
    private final SiteRegistry registry;
    private final FreshnessMonitor freshness;
    private final StateStore stateStore;
    private final PipelineProperties.Sync sync;
    
    public SiteSelector(SiteRegistry registry, FreshnessMonitor freshness, StateStore stateStore,
                        PipelineProperties properties) {
        this.registry = registry;
        this.freshness = freshness;
        this.stateStore = stateStore;
        this.sync = properties.getSync();
    }
    
    public List<String> select(Instant now) {
        List<String> sites = shardSites();
        if (sites.isEmpty()) {
            return sites;
        }
        int limit = Math.min(sync.getMaxSitesPerRun(), sites.size());
        
        Map<String, Optional<Duration>> ages = new HashMap<>();
        for (String site : sites) {
            ages.put(site, freshness.dataAge(site, now));
        }
        
        Set<String> selected = new LinkedHashSet<>();
        sites.stream()
                .filter(site -> freshness.isUrgent(ages.get(site)))
                .sorted(Comparator.comparing((String site) -> ageOrMax(ages.get(site))).reversed())
                .limit(limit)
                .forEach(selected::add);
        int urgent = selected.size();
        
        int cursor = Math.floorMod(stateStore.findSiteCursor(), sites.size());
        int next = cursor;
        for (int step = 0; step < sites.size() && selected.size() < limit; step++) {
            int index = (cursor + step) % sites.size();
            if (selected.add(sites.get(index))) {
                next = (index + 1) % sites.size();
            }
        }
        if (next != cursor) {
            stateStore.saveSiteCursor(next);
        }
        
        List<String> result = new ArrayList<>(selected);
        log.info("Sites selected: total={}, urgent={}, roundRobin={}, cursor={} -> {}, sites={}",
                sites.size(), urgent, result.size() - urgent, cursor, next, result);
        return result;
    }
    
    /**
     * Registered sites that belong to this deployment's shard.
     */
    public List<String> shardSites() {
        List<String> sites = registry.listSites();
        if (sync.getShardCount() <= 1) {
            return sites;
        }
        return sites.stream()
                .filter(site -> shardOf(site, sync.getShardCount()) == sync.getShardIndex())
                .collect(Collectors.toList());
    }
    
    /**
     * djb2 string hash modulo the shard count.
     */
    static int shardOf(String site, int shardCount) {
        int hash = 5381;
        for (int i = 0; i < site.length(); i++) {
            hash = ((hash << 5) + hash) + site.charAt(i);
        }
        return (int) (Math.abs((long) hash) % shardCount);
    }
    
    private static Duration ageOrMax(Optional<Duration> age) {
        return age.orElse(Duration.ofSeconds(Long.MAX_VALUE));
    }
}
