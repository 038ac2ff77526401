package com.koni.vitals.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One entry of a backfill's error log.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class BackfillError {
    
    @JsonProperty("timestamp")
    private final Instant timestamp;
    
    @JsonProperty("date")
    private final LocalDate date;
    
    @JsonProperty("cursor")
    private final String cursor;
    
    @JsonProperty("error")
    private final String message;
    
    @JsonCreator
    public BackfillError(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("date") LocalDate date,
            @JsonProperty("cursor") String cursor,
            @JsonProperty("error") String message) {
        this.timestamp = timestamp;
        this.date = date;
        this.cursor = cursor;
        this.message = message;
    }
}
