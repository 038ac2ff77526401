package com.koni.vitals.infrastructure.persistence.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.vitals.application.port.RunLock;
import com.koni.vitals.domain.model.LockRecord;
import com.koni.vitals.domain.repository.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * RunLock backed by {@code lock:{scope}} records in the key-value store.
 *
 * Every acquisition writes a fresh owner token, and release deletes the record only while that
 * token still owns it. Acquisition fails open: if the store cannot be read or written the lock is
 * reported as acquired.
 */
@Slf4j
@Component
public class StateStoreRunLock implements RunLock {
    
    static final String LOCK_PREFIX = "lock:";
    
    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    
    public StateStoreRunLock(KeyValueStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }
    
    @Override
    public Optional<String> acquire(String scope, Duration ttl) {
        String key = LOCK_PREFIX + scope;
        String leaseToken = UUID.randomUUID().toString();
        Instant now = clock.instant();
        try {
            Optional<LockRecord> existing = store.get(key).map(this::parse);
            if (existing.isPresent() && !existing.get().isExpiredAt(now)) {
                log.info("Run lock held: scope={}, owner={}, expiresAt={}",
                        scope, existing.get().getOwnerId(), existing.get().getExpiresAt());
                return Optional.empty();
            }
            LockRecord record = new LockRecord(key, leaseToken, now, now.plus(ttl));
            store.put(key, objectMapper.writeValueAsString(record), ttl);
            log.debug("Run lock acquired: scope={}, owner={}, ttl={}", scope, leaseToken, ttl);
            return Optional.of(leaseToken);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Run lock store unavailable, proceeding without lock: scope={}, error={}",
                    scope, e.getMessage());
            return Optional.of(leaseToken);
        }
    }
    
    @Override
    public void release(String scope, String leaseToken) {
        String key = LOCK_PREFIX + scope;
        try {
            Optional<LockRecord> existing = store.get(key).map(this::parse);
            if (existing.isEmpty()) {
                log.debug("Run lock already gone: scope={}", scope);
                return;
            }
            if (!leaseToken.equals(existing.get().getOwnerId())) {
                log.warn("Run lock expired and was taken over, leaving it in place: scope={}, owner={}",
                        scope, existing.get().getOwnerId());
                return;
            }
            store.delete(key);
            log.debug("Run lock released: scope={}", scope);
        } catch (RuntimeException e) {
            log.warn("Failed to release run lock, it will expire: scope={}, error={}", scope, e.getMessage());
        }
    }
    
    private LockRecord parse(String json) {
        try {
            return objectMapper.readValue(json, LockRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed lock record", e);
        }
    }
}
