package com.koni.vitals.domain.model;

/**
 * Classification of a site's data age.
 */
public enum Freshness {
    /** Recent enough that a sync cycle would be a no-op. */
    FRESH,
    /** Within the catch-up target. */
    CURRENT,
    /** Older than the catch-up target lag. */
    LAGGING,
    /** Older than the urgent threshold; prioritized by site selection. */
    URGENT,
    /** No samples in the hot store yet. */
    UNKNOWN
}
