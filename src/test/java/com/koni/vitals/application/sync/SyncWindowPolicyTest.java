package com.koni.vitals.application.sync;

import com.koni.vitals.domain.model.SyncState;
import com.koni.vitals.domain.model.TimeWindow;
import com.koni.vitals.support.TestProperties;
import com.koni.vitals.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class SyncWindowPolicyTest {
    
    private static final Instant NOW = Instant.parse("2025-01-15T12:05:00Z");
    
    private final SyncWindowPolicy policy = new SyncWindowPolicy(TestProperties.defaults());
    
    @Test
    void shouldFetchLastDayOnFirstSync() {
        TimeWindow window = policy.nextWindow(Optional.empty(), OptionalLong.empty(), NOW);
        
        assertThat(window.getStart()).isEqualTo(NOW.minus(Duration.ofHours(24)));
        assertThat(window.getEnd()).isEqualTo(NOW);
    }
    
    @Test
    void shouldTreatStaleStateAsFirstSync() {
        SyncState stale = SyncState.initial("building-a", NOW.minus(Duration.ofDays(8)).toEpochMilli(), NOW);
        
        assertThat(policy.isFirstSync(Optional.of(stale), NOW)).isTrue();
        assertThat(policy.nextWindow(Optional.of(stale), OptionalLong.empty(), NOW).getStart())
                .isEqualTo(NOW.minus(Duration.ofHours(24)));
    }
    
    @Test
    void shouldOverlapLastSyncByLookback() {
        Instant lastSync = NOW.minus(Duration.ofMinutes(5));
        SyncState state = SyncState.initial("building-a", lastSync.toEpochMilli(), NOW);
        
        TimeWindow window = policy.nextWindow(Optional.of(state), OptionalLong.empty(), NOW);
        
        assertThat(window.getStart()).isEqualTo(lastSync.minus(Duration.ofMinutes(10)));
        assertThat(window.getEnd()).isEqualTo(NOW);
    }
    
    @Test
    void shouldCapLongWindowAtTheEnd() {
        Instant lastSync = NOW.minus(Duration.ofHours(3));
        SyncState state = SyncState.initial("building-a", lastSync.toEpochMilli(), NOW);
        
        TimeWindow window = policy.nextWindow(Optional.of(state), OptionalLong.empty(), NOW);
        
        assertThat(window.getStart()).isEqualTo(lastSync.minus(Duration.ofMinutes(10)));
        assertThat(window.length()).isEqualTo(Duration.ofMinutes(30));
    }
    
    @Test
    void shouldStartFromScanPositionWhenAheadOfLastSync() {
        Instant lastSync = NOW.minus(Duration.ofHours(3));
        Instant scanned = lastSync.plus(Duration.ofMinutes(20));
        SyncState state = SyncState.initial("building-a", lastSync.toEpochMilli(), NOW);
        
        TimeWindow window = policy.nextWindow(Optional.of(state), OptionalLong.of(scanned.toEpochMilli()), NOW);
        
        assertThat(window.getStart()).isEqualTo(scanned.minus(Duration.ofMinutes(10)));
    }
    
    @Test
    void shouldIgnoreScanPositionBehindLastSync() {
        Instant lastSync = NOW.minus(Duration.ofMinutes(5));
        SyncState state = SyncState.initial("building-a", lastSync.toEpochMilli(), NOW);
        
        TimeWindow window = policy.nextWindow(Optional.of(state),
                OptionalLong.of(lastSync.minus(Duration.ofHours(1)).toEpochMilli()), NOW);
        
        assertThat(window.getStart()).isEqualTo(lastSync.minus(Duration.ofMinutes(10)));
    }
    
    @Test
    void shouldClampStartWhenStateIsInTheFuture() {
        SyncState ahead = SyncState.initial("building-a", NOW.plus(Duration.ofHours(1)).toEpochMilli(), NOW);
        
        TimeWindow window = policy.nextWindow(Optional.of(ahead), OptionalLong.empty(), NOW);
        
        assertThat(window.getStart()).isEqualTo(NOW.minus(Duration.ofMinutes(10)));
        assertThat(window.getEnd()).isEqualTo(NOW);
    }
    
    @Test
    void shouldRefillLastHour() {
        TimeWindow window = policy.refillWindow(NOW);
        
        assertThat(window.getStart()).isEqualTo(NOW.minus(Duration.ofMinutes(60)));
        assertThat(window.getEnd()).isEqualTo(NOW);
    }
}
