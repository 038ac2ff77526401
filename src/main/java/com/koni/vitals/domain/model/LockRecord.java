package com.koni.vitals.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Advisory run lock record. A record past its expiry no longer blocks acquisition.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class LockRecord {
    
    @JsonProperty("key")
    private final String key;
    
    @JsonProperty("id")
    private final String ownerId;
    
    @JsonProperty("acquired_at")
    private final Instant acquiredAt;
    
    @JsonProperty("expires_at")
    private final Instant expiresAt;
    
    @JsonCreator
    public LockRecord(
            @JsonProperty("key") String key,
            @JsonProperty("id") String ownerId,
            @JsonProperty("acquired_at") Instant acquiredAt,
            @JsonProperty("expires_at") Instant expiresAt) {
        this.key = key;
        this.ownerId = ownerId;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
    }
    
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
