package com.koni.vitals.application.sync;

import com.koni.vitals.domain.model.Sample;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.OptionalLong;

/**
 * All samples fetched for one window, across point chunks and pages.
 */
@Getter
@ToString(exclude = "samples")
public class FetchResult {
    
    private final List<Sample> samples;
    private final int droppedCount;
    private final int pagesFetched;
    private final boolean truncated;
    
    public FetchResult(List<Sample> samples, int droppedCount, int pagesFetched, boolean truncated) {
        this.samples = List.copyOf(samples);
        this.droppedCount = droppedCount;
        this.pagesFetched = pagesFetched;
        this.truncated = truncated;
    }
    
    public OptionalLong maxTimestamp() {
        return samples.stream().mapToLong(Sample::getTimestamp).max();
    }
}
