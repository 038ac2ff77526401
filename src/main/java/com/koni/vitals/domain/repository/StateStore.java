package com.koni.vitals.domain.repository;

import com.koni.vitals.domain.model.ArchiveRunStats;
import com.koni.vitals.domain.model.BackfillState;
import com.koni.vitals.domain.model.SyncRunResult;
import com.koni.vitals.domain.model.SyncState;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Typed access to the durable pipeline state.
 *
 * Implementations throw {@link com.koni.vitals.domain.exception.StateStoreUnavailableException}
 * when the store cannot be read or written. Callers must not swallow it: a lost checkpoint
 * would make the next invocation repeat or skip work.
 */
public interface StateStore {
    
    Optional<SyncState> findSyncState(String site);
    
    void saveSyncState(SyncState state);
    
    /**
     * Deletes the sync position and the scan position of the site.
     */
    void deleteSyncState(String site);
    
    /**
     * End of the newest window that was scanned completely without finding samples newer than
     * the sync position. Kept apart from {@link SyncState} so the sync position only ever holds
     * written timestamps.
     */
    OptionalLong findScanPosition(String site);
    
    void saveScanPosition(String site, long timestamp);
    
    Optional<BackfillState> findBackfillState(String site);
    
    void saveBackfillState(BackfillState state);
    
    void saveSyncRun(SyncRunResult result);
    
    Optional<SyncRunResult> findLastSyncRun();
    
    void saveArchiveRun(ArchiveRunStats stats);
    
    Optional<ArchiveRunStats> findLastArchiveRun();
    
    Optional<List<String>> findRegisteredSites();
    
    void saveRegisteredSites(List<String> sites);
    
    int findSiteCursor();
    
    void saveSiteCursor(int cursor);
    
    boolean isWindowDone(String windowKey);
    
    void markWindowDone(String windowKey, Duration ttl);
}
