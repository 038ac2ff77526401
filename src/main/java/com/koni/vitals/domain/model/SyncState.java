package com.koni.vitals.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * Incremental sync position of one site.
 * The timestamp is the newest sample actually written to the hot store and never moves backwards.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SyncState {
    
    @JsonProperty("site")
    private final String site;
    
    @JsonProperty("last_sync_timestamp")
    private final long lastSyncTimestamp;
    
    @JsonProperty("updated_at")
    private final Instant updatedAt;
    
    @JsonCreator
    public SyncState(
            @JsonProperty("site") String site,
            @JsonProperty("last_sync_timestamp") long lastSyncTimestamp,
            @JsonProperty("updated_at") Instant updatedAt) {
        this.site = site;
        this.lastSyncTimestamp = lastSyncTimestamp;
        this.updatedAt = updatedAt;
    }
    
    public static SyncState initial(String site, long lastSyncTimestamp, Instant now) {
        return new SyncState(site, lastSyncTimestamp, now);
    }
    
    /**
     * Returns a state advanced to the given timestamp, or this state if the timestamp is not newer.
     */
    public SyncState advanceTo(long timestamp, Instant now) {
        if (timestamp <= lastSyncTimestamp) {
            return this;
        }
        return new SyncState(site, timestamp, now);
    }
    
    public boolean isOlderThan(Duration threshold, Instant now) {
        return Instant.ofEpochMilli(lastSyncTimestamp).isBefore(now.minus(threshold));
    }
    
    public Instant lastSyncInstant() {
        return Instant.ofEpochMilli(lastSyncTimestamp);
    }
}
