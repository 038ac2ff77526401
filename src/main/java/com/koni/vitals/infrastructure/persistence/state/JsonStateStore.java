package com.koni.vitals.infrastructure.persistence.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.model.ArchiveRunStats;
import com.koni.vitals.domain.model.BackfillState;
import com.koni.vitals.domain.model.SyncRunResult;
import com.koni.vitals.domain.model.SyncState;
import com.koni.vitals.domain.repository.KeyValueStore;
import com.koni.vitals.domain.repository.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * StateStore that keeps every state object as a JSON document in the key-value store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonStateStore implements StateStore {
    
    static final String SYNC_STATE_PREFIX = "sync:last_sync:";
    static final String BACKFILL_PREFIX = "backfill:";
    static final String SYNC_METRICS_PREFIX = "sync:metrics:";
    static final String SYNC_LAST_RUN = "sync:last_run";
    static final String ARCHIVE_METRICS_PREFIX = "archive:metrics:";
    static final String ARCHIVE_LAST_RUN = "archive:last_run";
    static final String SITES_LIST = "sites:list";
    static final String SITES_CURSOR = "sites:cursor";
    static final String WINDOW_DONE_PREFIX = "sync:window_done:";
    static final String SCAN_POSITION_PREFIX = "sync:scan:";
    
    private static final Duration RUN_METRICS_TTL = Duration.ofDays(7);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() { };
    
    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    
    @Override
    public Optional<SyncState> findSyncState(String site) {
        return read(SYNC_STATE_PREFIX + site, SyncState.class);
    }
    
    @Override
    public void saveSyncState(SyncState state) {
        write(SYNC_STATE_PREFIX + state.getSite(), state, null);
    }
    
    @Override
    public void deleteSyncState(String site) {
        store.delete(SYNC_STATE_PREFIX + site);
        store.delete(SCAN_POSITION_PREFIX + site);
    }
    
    @Override
    public OptionalLong findScanPosition(String site) {
        Optional<String> value = store.get(SCAN_POSITION_PREFIX + site);
        if (value.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value.get().trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed scan position: site={}, value={}", site, value.get());
            return OptionalLong.empty();
        }
    }
    
    @Override
    public void saveScanPosition(String site, long timestamp) {
        store.put(SCAN_POSITION_PREFIX + site, Long.toString(timestamp));
    }
    
    @Override
    public Optional<BackfillState> findBackfillState(String site) {
        return read(BACKFILL_PREFIX + site, BackfillState.class);
    }
    
    @Override
    public void saveBackfillState(BackfillState state) {
        write(BACKFILL_PREFIX + state.getSite(), state, null);
    }
    
    @Override
    public void saveSyncRun(SyncRunResult result) {
        write(SYNC_METRICS_PREFIX + result.getSyncId(), result, RUN_METRICS_TTL);
        write(SYNC_LAST_RUN, result, null);
    }
    
    @Override
    public Optional<SyncRunResult> findLastSyncRun() {
        return read(SYNC_LAST_RUN, SyncRunResult.class);
    }
    
    @Override
    public void saveArchiveRun(ArchiveRunStats stats) {
        write(ARCHIVE_METRICS_PREFIX + stats.getRunId(), stats, null);
        write(ARCHIVE_LAST_RUN, stats, null);
    }
    
    @Override
    public Optional<ArchiveRunStats> findLastArchiveRun() {
        return read(ARCHIVE_LAST_RUN, ArchiveRunStats.class);
    }
    
    @Override
    public Optional<List<String>> findRegisteredSites() {
        return store.get(SITES_LIST).map(json -> deserialize(SITES_LIST, json, STRING_LIST));
    }
    
    @Override
    public void saveRegisteredSites(List<String> sites) {
        write(SITES_LIST, sites, null);
    }
    
    @Override
    public int findSiteCursor() {
        return store.get(SITES_CURSOR).map(value -> {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed site cursor value={}", value);
                return 0;
            }
        }).orElse(0);
    }
    
    @Override
    public void saveSiteCursor(int cursor) {
        store.put(SITES_CURSOR, Integer.toString(cursor));
    }
    
    @Override
    public boolean isWindowDone(String windowKey) {
        return store.get(WINDOW_DONE_PREFIX + windowKey).isPresent();
    }
    
    @Override
    public void markWindowDone(String windowKey, Duration ttl) {
        store.put(WINDOW_DONE_PREFIX + windowKey, "1", ttl);
    }
    
    private <T> Optional<T> read(String key, Class<T> type) {
        return store.get(key).map(json -> {
            try {
                return objectMapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new StateStoreUnavailableException("Corrupt state under key " + key, e);
            }
        });
    }
    
    private <T> T deserialize(String key, String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StateStoreUnavailableException("Corrupt state under key " + key, e);
        }
    }
    
    private void write(String key, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state for key " + key, e);
        }
        if (ttl == null) {
            store.put(key, json);
        } else {
            store.put(key, json, ttl);
        }
    }
}
