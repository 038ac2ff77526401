package com.koni.vitals.domain.repository;

import com.koni.vitals.domain.model.Sample;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the hot sample store.
 * This is a port in Hexagonal Architecture that will be implemented by infrastructure adapters.
 *
 * Samples are keyed by (site, pointName, timestamp); writing the same key twice overwrites
 * the value and never creates a second row.
 */
public interface HotSampleRepository {
    
    /**
     * Inserts or overwrites the given samples.
     *
     * @param samples the samples to write
     * @return the number of samples written
     */
    int upsertAll(List<Sample> samples);
    
    /**
     * Finds the newest sample timestamp of a site.
     *
     * @param site the site name
     * @return the newest timestamp in epoch milliseconds, or empty if the site has no samples
     */
    Optional<Long> findLatestTimestamp(String site);
    
    /**
     * Lists the points of a site that have samples older than the given timestamp.
     */
    List<String> findPointNamesBefore(String site, long beforeMillis);
    
    /**
     * Finds the oldest timestamp of a point older than the given bound.
     */
    Optional<Long> findEarliestTimestamp(String site, String pointName, long beforeMillis);
    
    /**
     * Counts samples of a point in {@code [fromMillis, toMillis)}.
     */
    long countInRange(String site, String pointName, long fromMillis, long toMillis);
    
    /**
     * Reads up to {@code limit} samples of a point in {@code [fromMillis, toMillis)} with a
     * timestamp greater than {@code afterMillis}, in timestamp order.
     */
    List<Sample> findPage(String site, String pointName, long fromMillis, long toMillis, long afterMillis, int limit);
    
    /**
     * Deletes the samples of a point in {@code [fromMillis, toMillis)}.
     *
     * @return the number of rows deleted
     */
    int deleteRange(String site, String pointName, long fromMillis, long toMillis);
}
