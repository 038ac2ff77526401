package com.koni.vitals.infrastructure.client.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Body of {@code GET /sites/{site}/timeseries/paginated}.
 * A missing {@code has_more} is inferred from the presence of a cursor.
 */
@Getter
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaginatedTimeseriesResponse {
    
    private final List<PointSample> pointSamples;
    private final String nextCursor;
    private final boolean hasMore;
    
    @JsonCreator
    public PaginatedTimeseriesResponse(
            @JsonProperty("point_samples") List<PointSample> pointSamples,
            @JsonProperty("next_cursor") String nextCursor,
            @JsonProperty("has_more") Boolean hasMore) {
        this.pointSamples = pointSamples == null ? Collections.emptyList() : pointSamples;
        this.nextCursor = nextCursor;
        this.hasMore = hasMore == null ? nextCursor != null && !nextCursor.isBlank() : hasMore;
    }
}
