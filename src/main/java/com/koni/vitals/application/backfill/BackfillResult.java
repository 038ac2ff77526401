package com.koni.vitals.application.backfill;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.vitals.domain.model.BackfillError;
import com.koni.vitals.domain.model.BackfillState;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of one backfill invocation for one site.
 *
 * {@code status} is the backfill state's status, except {@code error} when this invocation
 * stopped on a failure and {@code skipped} when another invocation held the site's lock.
 */
@Getter
@ToString
public class BackfillResult {
    
    public static final String ERROR = "error";
    public static final String SKIPPED = "skipped";
    
    @JsonProperty("status")
    private final String status;
    
    @JsonProperty("site")
    private final String site;
    
    @JsonProperty("progress")
    private final BackfillProgress progress;
    
    @JsonProperty("pages_processed")
    private final int pagesProcessed;
    
    @JsonProperty("continuation")
    private final boolean continuation;
    
    @JsonProperty("errors")
    private final List<BackfillError> errors;
    
    public BackfillResult(String status, String site, BackfillProgress progress, int pagesProcessed,
                          boolean continuation, List<BackfillError> errors) {
        this.status = status;
        this.site = site;
        this.progress = progress;
        this.pagesProcessed = pagesProcessed;
        this.continuation = continuation;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }
    
    static BackfillResult of(BackfillState state, int pagesProcessed, boolean continuation) {
        return new BackfillResult(state.getStatus().wireValue(), state.getSite(), new BackfillProgress(state),
                pagesProcessed, continuation, state.getErrors());
    }
    
    static BackfillResult failed(BackfillState state, int pagesProcessed) {
        return new BackfillResult(ERROR, state.getSite(), new BackfillProgress(state), pagesProcessed,
                false, state.getErrors());
    }
}
