package com.koni.vitals.application.service;

import com.koni.vitals.domain.model.Freshness;
import com.koni.vitals.domain.repository.HotSampleRepository;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Measures how far the hot store of a site lags behind the wall clock.
 */
@Service
public class FreshnessMonitor {
    
    private final HotSampleRepository hotSamples;
    private final PipelineProperties.Sync sync;
    
    public FreshnessMonitor(HotSampleRepository hotSamples, PipelineProperties properties) {
        this.hotSamples = hotSamples;
        this.sync = properties.getSync();
    }
    
    /**
     * Returns {@code now - newest sample time}, never negative, or empty when the site has no samples.
     */
    public Optional<Duration> dataAge(String site, Instant now) {
        return hotSamples.findLatestTimestamp(site)
                .map(latest -> {
                    Duration age = Duration.between(Instant.ofEpochMilli(latest), now);
                    return age.isNegative() ? Duration.ZERO : age;
                });
    }
    
    public Freshness classify(String site, Instant now) {
        return classify(dataAge(site, now));
    }
    
    public Freshness classify(Optional<Duration> age) {
        if (age.isEmpty()) {
            return Freshness.UNKNOWN;
        }
        Duration value = age.get();
        if (value.compareTo(sync.getSkipIfFresherThan()) <= 0) {
            return Freshness.FRESH;
        }
        if (value.compareTo(sync.getTargetLag()) <= 0) {
            return Freshness.CURRENT;
        }
        if (value.compareTo(sync.getUrgentAge()) > 0) {
            return Freshness.URGENT;
        }
        return Freshness.LAGGING;
    }
    
    /**
     * True when the site is too fresh to be worth a sync cycle.
     */
    public boolean isFresh(Optional<Duration> age) {
        return age.isPresent() && age.get().compareTo(sync.getSkipIfFresherThan()) <= 0;
    }
    
    /**
     * True when the site has caught up to the target lag.
     */
    public boolean isWithinTargetLag(Optional<Duration> age) {
        return age.isPresent() && age.get().compareTo(sync.getTargetLag()) <= 0;
    }
    
    /**
     * True when the site is urgent; a site without samples counts as infinitely old.
     */
    public boolean isUrgent(Optional<Duration> age) {
        return age.isEmpty() || age.get().compareTo(sync.getUrgentAge()) > 0;
    }
}
