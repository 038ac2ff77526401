package com.koni.vitals.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * SyncWindowRequested event.
 * Asks a consumer to fetch one explicit time window of one site into the hot store,
 * independently of the incremental sync position.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SyncWindowRequested {
    
    private final UUID requestId;
    private final String site;
    private final Instant start;
    private final Instant end;
    private final List<String> pointNames;
    private final Instant requestedAt;
    
    /**
     * Creates a new SyncWindowRequested event.
     * This constructor is used by Jackson for JSON deserialization.
     *
     * @param requestId the unique identifier of this request
     * @param site the site to fetch
     * @param start the window start
     * @param end the window end
     * @param pointNames the points to fetch, or empty for all points
     * @param requestedAt when the request was published
     */
    @JsonCreator
    public SyncWindowRequested(
            @JsonProperty("requestId") UUID requestId,
            @JsonProperty("site") String site,
            @JsonProperty("start") Instant start,
            @JsonProperty("end") Instant end,
            @JsonProperty("pointNames") List<String> pointNames,
            @JsonProperty("requestedAt") Instant requestedAt) {
        this.requestId = requestId;
        this.site = site;
        this.start = start;
        this.end = end;
        this.pointNames = pointNames == null ? Collections.emptyList() : List.copyOf(pointNames);
        this.requestedAt = requestedAt;
    }
    
    /**
     * Key of the done marker written once this window has been fully ingested.
     */
    public String doneKey() {
        return site + ":" + start.toEpochMilli() + ":" + end.toEpochMilli();
    }
}
