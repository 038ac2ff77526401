package com.koni.vitals.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One page of normalized samples returned by the upstream API.
 * A null next cursor means the queried window has no further pages. The upstream
 * {@code has_more} flag is carried separately and never clears the cursor.
 */
@Getter
@ToString(exclude = "samples")
public final class SamplePage {
    
    private final List<Sample> samples;
    private final String nextCursor;
    private final boolean moreAvailable;
    private final int droppedCount;
    
    public SamplePage(List<Sample> samples, String nextCursor, int droppedCount) {
        this(samples, nextCursor, nextCursor != null, droppedCount);
    }
    
    public SamplePage(List<Sample> samples, String nextCursor, boolean moreAvailable, int droppedCount) {
        this.samples = List.copyOf(samples);
        this.nextCursor = nextCursor;
        this.moreAvailable = moreAvailable;
        this.droppedCount = droppedCount;
    }
    
    public boolean isLastPage() {
        return nextCursor == null;
    }
}
