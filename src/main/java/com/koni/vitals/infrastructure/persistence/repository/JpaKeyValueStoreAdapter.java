package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.repository.KeyValueStore;
import com.koni.vitals.infrastructure.persistence.entity.StateEntryEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * JPA adapter for KeyValueStore backed by the {@code pipeline_state} table.
 * Database failures are rethrown as StateStoreUnavailableException.
 */
@Component
@RequiredArgsConstructor
public class JpaKeyValueStoreAdapter implements KeyValueStore {
    
    private final StateEntryJpaRepository jpaRepository;
    private final Clock clock;
    
    @Override
    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        requireKey(key);
        try {
            Instant now = clock.instant();
            return jpaRepository.findById(key)
                    .filter(entry -> !entry.isExpiredAt(now))
                    .map(StateEntryEntity::getValue);
        } catch (DataAccessException e) {
            throw new StateStoreUnavailableException("Failed to read state key " + key, e);
        }
    }
    
    @Override
    @Transactional
    public void put(String key, String value) {
        write(key, value, null);
    }
    
    @Override
    @Transactional
    public void put(String key, String value, Duration ttl) {
        if (ttl == null) {
            throw new IllegalArgumentException("TTL cannot be null");
        }
        write(key, value, ttl);
    }
    
    @Override
    @Transactional
    public void delete(String key) {
        requireKey(key);
        try {
            if (jpaRepository.existsById(key)) {
                jpaRepository.deleteById(key);
            }
        } catch (DataAccessException e) {
            throw new StateStoreUnavailableException("Failed to delete state key " + key, e);
        }
    }
    
    @Override
    @Transactional
    public int purgeExpired() {
        try {
            return jpaRepository.deleteExpired(clock.instant());
        } catch (DataAccessException e) {
            throw new StateStoreUnavailableException("Failed to purge expired state", e);
        }
    }
    
    private void write(String key, String value, Duration ttl) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        try {
            Instant now = clock.instant();
            StateEntryEntity entry = jpaRepository.findById(key).orElseGet(StateEntryEntity::new);
            entry.setKey(key);
            entry.setValue(value);
            entry.setExpiresAt(ttl == null ? null : now.plus(ttl));
            entry.setUpdatedAt(now);
            jpaRepository.save(entry);
        } catch (DataAccessException e) {
            throw new StateStoreUnavailableException("Failed to write state key " + key, e);
        }
    }
    
    private void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be blank");
        }
    }
}
