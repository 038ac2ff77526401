package com.koni.vitals.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Metadata of an object in cold storage.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class StoredObject {
    
    private final String key;
    private final long size;
    private final Instant lastModified;
    
    public StoredObject(String key, long size, Instant lastModified) {
        this.key = key;
        this.size = size;
        this.lastModified = lastModified;
    }
}
