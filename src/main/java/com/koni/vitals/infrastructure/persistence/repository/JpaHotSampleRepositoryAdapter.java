package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.domain.model.Sample;
import com.koni.vitals.domain.repository.HotSampleRepository;
import com.koni.vitals.infrastructure.persistence.entity.SampleEntity;
import io.micrometer.observation.annotation.Observed;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JPA adapter for HotSampleRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 *
 * Upserts go through {@code merge}, so writing an existing (site, point, timestamp)
 * overwrites its value instead of inserting a second row.
 */
@Component
@RequiredArgsConstructor
public class JpaHotSampleRepositoryAdapter implements HotSampleRepository {
    
    private static final int FLUSH_EVERY = 1_000;
    
    private final SampleJpaRepository jpaRepository;
    private final EntityManager entityManager;
    private final Clock clock;
    
    /**
     * Writes the samples in chunks, flushing and clearing the persistence context between
     * chunks so large pages do not accumulate managed entities.
     *
     * @throws IllegalArgumentException if samples is null
     */
    @Override
    @Transactional
    @Observed(name = "hotstore.upsert", contextualName = "hot-sample-upsert")
    public int upsertAll(List<Sample> samples) {
        if (samples == null) {
            throw new IllegalArgumentException("Samples cannot be null");
        }
        if (samples.isEmpty()) {
            return 0;
        }
        
        Instant now = clock.instant();
        for (int from = 0; from < samples.size(); from += FLUSH_EVERY) {
            List<SampleEntity> chunk = samples.subList(from, Math.min(from + FLUSH_EVERY, samples.size()))
                    .stream()
                    .map(sample -> toEntity(sample, now))
                    .collect(Collectors.toList());
            jpaRepository.saveAll(chunk);
            entityManager.flush();
            entityManager.clear();
        }
        return samples.size();
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<Long> findLatestTimestamp(String site) {
        requireSite(site);
        return Optional.ofNullable(jpaRepository.findMaxTimestamp(site));
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<String> findPointNamesBefore(String site, long beforeMillis) {
        requireSite(site);
        return jpaRepository.findDistinctPointNamesBefore(site, beforeMillis);
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<Long> findEarliestTimestamp(String site, String pointName, long beforeMillis) {
        requireSite(site);
        return Optional.ofNullable(jpaRepository.findMinTimestampBefore(site, pointName, beforeMillis));
    }
    
    @Override
    @Transactional(readOnly = true)
    public long countInRange(String site, String pointName, long fromMillis, long toMillis) {
        requireSite(site);
        return jpaRepository.countInRange(site, pointName, fromMillis, toMillis);
    }
    
    @Override
    @Transactional(readOnly = true)
    @Observed(name = "hotstore.page", contextualName = "hot-sample-page")
    public List<Sample> findPage(String site, String pointName, long fromMillis, long toMillis,
                                 long afterMillis, int limit) {
        requireSite(site);
        return jpaRepository.findPageAfter(site, pointName, fromMillis, toMillis, afterMillis, PageRequest.of(0, limit))
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }
    
    @Override
    @Transactional
    @Observed(name = "hotstore.delete", contextualName = "hot-sample-delete")
    public int deleteRange(String site, String pointName, long fromMillis, long toMillis) {
        requireSite(site);
        return jpaRepository.deleteRange(site, pointName, fromMillis, toMillis);
    }
    
    private void requireSite(String site) {
        if (site == null) {
            throw new IllegalArgumentException("Site cannot be null");
        }
    }
    
    private SampleEntity toEntity(Sample sample, Instant ingestedAt) {
        return new SampleEntity(
            sample.getSite(),
            sample.getPointName(),
            sample.getTimestamp(),
            sample.getValue(),
            ingestedAt
        );
    }
    
    private Sample toDomain(SampleEntity entity) {
        return new Sample(entity.getSite(), entity.getPointName(), entity.getTimestamp(), entity.getValue());
    }
}
