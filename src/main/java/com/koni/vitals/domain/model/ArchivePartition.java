package com.koni.vitals.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Unit of archival: all samples of one point of one site on one UTC day.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ArchivePartition {
    
    private final String site;
    private final String pointName;
    private final LocalDate day;
    
    public ArchivePartition(String site, String pointName, LocalDate day) {
        this.site = site;
        this.pointName = pointName;
        this.day = day;
    }
    
    /**
     * Inclusive lower bound in epoch milliseconds.
     */
    public long startMillis() {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
    
    /**
     * Exclusive upper bound in epoch milliseconds.
     */
    public long endMillisExclusive() {
        return day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
    
    public String objectKey(String extension) {
        return ColdStoragePaths.objectKey(site, day, pointName, extension);
    }
}
