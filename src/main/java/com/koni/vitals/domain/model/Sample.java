package com.koni.vitals.domain.model;

import com.koni.vitals.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Sample value object: one reading of one point at one instant.
 * Immutable once built; identified by (site, pointName, timestamp).
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Sample {
    
    private final String site;
    private final String pointName;
    private final long timestamp;
    private final double value;
    
    /**
     * Creates a new Sample.
     *
     * @param site the site the point belongs to
     * @param pointName the upstream point name
     * @param timestamp the sample time in epoch milliseconds
     * @param value the reading
     * @throws ValidationException if site or point name is blank or the value is not finite
     */
    public Sample(String site, String pointName, long timestamp, double value) {
        if (site == null || site.isBlank()) {
            throw new ValidationException("site is required");
        }
        if (pointName == null || pointName.isBlank()) {
            throw new ValidationException("pointName is required");
        }
        if (!Double.isFinite(value)) {
            throw new ValidationException("value must be a finite number");
        }
        this.site = site;
        this.pointName = pointName;
        this.timestamp = timestamp;
        this.value = value;
    }
    
    public Instant instant() {
        return Instant.ofEpochMilli(timestamp);
    }
    
    /**
     * Identity of the sample within its site, used for de-duplication.
     */
    public String identity() {
        return pointName + ":" + timestamp;
    }
}
