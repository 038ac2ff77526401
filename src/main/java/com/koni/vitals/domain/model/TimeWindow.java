package com.koni.vitals.domain.model;

import com.koni.vitals.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Closed time range [start, end] used to query the upstream API.
 */
@Getter
@EqualsAndHashCode
public final class TimeWindow {
    
    private final Instant start;
    private final Instant end;
    
    public TimeWindow(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new ValidationException("window start and end are required");
        }
        if (end.isBefore(start)) {
            throw new ValidationException("window end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }
    
    /**
     * Whole-day window in UTC, from 00:00:00 to 23:59:59.
     */
    public static TimeWindow forDay(LocalDate day) {
        Instant start = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        return new TimeWindow(start, start.plus(Duration.ofDays(1)).minusSeconds(1));
    }
    
    public Duration length() {
        return Duration.between(start, end);
    }
    
    /**
     * Returns a window no longer than {@code max}, keeping the start and pulling the end back.
     */
    public TimeWindow capTo(Duration max) {
        if (length().compareTo(max) <= 0) {
            return this;
        }
        return new TimeWindow(start, start.plus(max));
    }
    
    public boolean contains(long epochMillis) {
        return epochMillis >= start.toEpochMilli() && epochMillis <= end.toEpochMilli();
    }
    
    public String startIso() {
        return DateTimeFormatter.ISO_INSTANT.format(start);
    }
    
    public String endIso() {
        return DateTimeFormatter.ISO_INSTANT.format(end);
    }
    
    @Override
    public String toString() {
        return "[" + startIso() + " .. " + endIso() + "]";
    }
}
