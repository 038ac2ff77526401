package com.koni.vitals.application.backfill;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.vitals.domain.model.BackfillState;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

/**
 * Progress snapshot of a backfill, in the shape returned by the status and trigger endpoints.
 */
@Getter
@ToString
public class BackfillProgress {
    
    @JsonProperty("current_date")
    private final LocalDate currentDate;
    
    @JsonProperty("current_cursor")
    private final String currentCursor;
    
    @JsonProperty("completed_dates")
    private final List<LocalDate> completedDates;
    
    @JsonProperty("percent")
    private final String percent;
    
    @JsonProperty("samples_fetched")
    private final long samplesFetched;
    
    @JsonProperty("pages_fetched")
    private final long pagesFetched;
    
    @JsonProperty("total_days")
    private final long totalDays;
    
    public BackfillProgress(BackfillState state) {
        this.currentDate = state.getCurrentDate();
        this.currentCursor = state.getCurrentCursor();
        this.completedDates = List.copyOf(state.getCompletedDates());
        this.percent = state.getPercentComplete();
        this.samplesFetched = state.getSamplesFetched();
        this.pagesFetched = state.getPagesFetched();
        this.totalDays = state.getTotalDays();
    }
}
