package com.koni.vitals.support;

import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.repository.KeyValueStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store held in a map, honouring TTLs against the given clock.
 * {@link #setAvailable(boolean)} simulates an outage.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    
    private final Clock clock;
    private final Map<String, String> values = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();
    private boolean available = true;
    
    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }
    
    public void setAvailable(boolean available) {
        this.available = available;
    }
    
    @Override
    public synchronized Optional<String> get(String key) {
        checkAvailable();
        Instant expiry = expiries.get(key);
        if (expiry != null && !expiry.isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }
    
    @Override
    public synchronized void put(String key, String value) {
        checkAvailable();
        values.put(key, value);
        expiries.remove(key);
    }
    
    @Override
    public synchronized void put(String key, String value, Duration ttl) {
        checkAvailable();
        values.put(key, value);
        expiries.put(key, clock.instant().plus(ttl));
    }
    
    @Override
    public synchronized void delete(String key) {
        checkAvailable();
        values.remove(key);
        expiries.remove(key);
    }
    
    @Override
    public synchronized int purgeExpired() {
        checkAvailable();
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, Instant> entry : expiries.entrySet()) {
            if (!entry.getValue().isAfter(now)) {
                expired.add(entry.getKey());
            }
        }
        for (String key : expired) {
            values.remove(key);
            expiries.remove(key);
        }
        return expired.size();
    }
    
    public synchronized boolean contains(String key) {
        return values.containsKey(key);
    }
    
    public synchronized Optional<Instant> expiryOf(String key) {
        return Optional.ofNullable(expiries.get(key));
    }
    
    private void checkAvailable() {
        if (!available) {
            throw new StateStoreUnavailableException("state store down");
        }
    }
}
