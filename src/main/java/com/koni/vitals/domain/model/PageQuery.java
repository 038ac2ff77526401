package com.koni.vitals.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * One request for a page of samples from the upstream API.
 * An empty point list means no point filter is sent.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PageQuery {
    
    private final String site;
    private final TimeWindow window;
    private final String cursor;
    private final List<String> pointNames;
    private final int pageSize;
    
    public PageQuery(String site, TimeWindow window, String cursor, List<String> pointNames, int pageSize) {
        this.site = site;
        this.window = window;
        this.cursor = cursor;
        this.pointNames = pointNames == null ? Collections.emptyList() : List.copyOf(pointNames);
        this.pageSize = pageSize;
    }
    
    public PageQuery withCursor(String nextCursor) {
        return new PageQuery(site, window, nextCursor, pointNames, pageSize);
    }
}
