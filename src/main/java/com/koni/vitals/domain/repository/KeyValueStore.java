package com.koni.vitals.domain.repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable string key-value store backing pipeline state and locks.
 * Entries written with a time-to-live read as absent once expired.
 */
public interface KeyValueStore {
    
    Optional<String> get(String key);
    
    void put(String key, String value);
    
    void put(String key, String value, Duration ttl);
    
    void delete(String key);
    
    /**
     * Physically removes expired entries.
     *
     * @return the number of entries removed
     */
    int purgeExpired();
}
