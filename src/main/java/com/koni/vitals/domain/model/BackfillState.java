package com.koni.vitals.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.vitals.domain.exception.IllegalBackfillTransitionException;
import com.koni.vitals.domain.exception.ValidationException;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Continuation state of a historical backfill for one site.
 *
 * The state walks its date range one day at a time and, within a day, one page at a time.
 * The current day only advances once the upstream API reports no further cursor for it,
 * so a day is never marked complete while pages remain.
 */
@Getter
@ToString
public class BackfillState {

    public static final int MAX_ERRORS = 50;

    @JsonProperty("site_name")
    private final String site;

    @JsonProperty("backfill_start")
    private final LocalDate rangeStart;

    @JsonProperty("backfill_end")
    private final LocalDate rangeEnd;

    @JsonProperty("direction")
    private final BackfillDirection direction;

    @JsonProperty("status")
    private BackfillStatus status;

    @JsonProperty("current_date")
    private LocalDate currentDate;

    @JsonProperty("current_cursor")
    private String currentCursor;

    @JsonProperty("completed_dates")
    private final List<LocalDate> completedDates;

    @JsonProperty("samples_fetched")
    private long samplesFetched;

    @JsonProperty("pages_fetched")
    private long pagesFetched;

    @JsonProperty("errors")
    private final List<BackfillError> errors;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @JsonCreator
    public BackfillState(
            @JsonProperty("site_name") String site,
            @JsonProperty("backfill_start") LocalDate rangeStart,
            @JsonProperty("backfill_end") LocalDate rangeEnd,
            @JsonProperty("direction") BackfillDirection direction,
            @JsonProperty("status") BackfillStatus status,
            @JsonProperty("current_date") LocalDate currentDate,
            @JsonProperty("current_cursor") String currentCursor,
            @JsonProperty("completed_dates") List<LocalDate> completedDates,
            @JsonProperty("samples_fetched") long samplesFetched,
            @JsonProperty("pages_fetched") long pagesFetched,
            @JsonProperty("errors") List<BackfillError> errors,
            @JsonProperty("started_at") Instant startedAt,
            @JsonProperty("last_updated") Instant lastUpdated) {
        this.site = site;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.direction = direction == null ? BackfillDirection.OLDEST_FIRST : direction;
        this.status = status == null ? BackfillStatus.NOT_STARTED : status;
        this.currentDate = currentDate;
        this.currentCursor = currentCursor;
        this.completedDates = completedDates == null ? new ArrayList<>() : new ArrayList<>(completedDates);
        this.samplesFetched = samplesFetched;
        this.pagesFetched = pagesFetched;
        this.errors = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
        this.startedAt = startedAt;
        this.lastUpdated = lastUpdated;
    }

    /**
     * Creates a not-yet-started backfill over the inclusive range.
     *
     * @throws ValidationException if the range is empty or inverted
     */
    public static BackfillState create(String site, LocalDate rangeStart, LocalDate rangeEnd,
                                       BackfillDirection direction, Instant now) {
        if (rangeStart == null || rangeEnd == null) {
            throw new ValidationException("backfill range start and end are required");
        }
        if (rangeEnd.isBefore(rangeStart)) {
            throw new ValidationException("backfill range end " + rangeEnd + " is before start " + rangeStart);
        }
        return new BackfillState(site, rangeStart, rangeEnd, direction, BackfillStatus.NOT_STARTED,
                null, null, null, 0, 0, null, null, now);
    }

    /**
     * Moves a new backfill to IN_PROGRESS, positioned at the first day of its range.
     */
    public void start(Instant now) {
        transitionTo(BackfillStatus.IN_PROGRESS);
        this.currentDate = direction.firstDay(rangeStart, rangeEnd);
        this.currentCursor = null;
        this.startedAt = now;
        this.lastUpdated = now;
    }

    /**
     * Records one successfully fetched page for the current day.
     * A null next cursor completes the day and moves to the next one, or completes the backfill
     * when the range is exhausted.
     *
     * @param sampleCount samples in the page
     * @param nextCursor the cursor for the next page of the same day, or null when the day is done
     */
    public void recordPage(int sampleCount, String nextCursor, Instant now) {
        if (status != BackfillStatus.IN_PROGRESS) {
            throw new IllegalStateException("Cannot record a page while backfill is " + status.wireValue());
        }
        this.samplesFetched += sampleCount;
        this.pagesFetched++;
        this.lastUpdated = now;

        if (nextCursor != null) {
            this.currentCursor = nextCursor;
            return;
        }

        if (!completedDates.contains(currentDate)) {
            completedDates.add(currentDate);
        }
        LocalDate next = direction.nextDay(currentDate);
        this.currentCursor = null;
        if (next.isAfter(rangeEnd) || next.isBefore(rangeStart)) {
            this.currentDate = null;
            transitionTo(BackfillStatus.COMPLETE);
        } else {
            this.currentDate = next;
        }
    }

    /**
     * Appends an error without moving the day or cursor, so the same page is retried next time.
     */
    public void recordError(String message, Instant now) {
        errors.add(new BackfillError(now, currentDate, currentCursor, message));
        while (errors.size() > MAX_ERRORS) {
            errors.remove(0);
        }
        this.lastUpdated = now;
    }

    /**
     * Records an error that retrying cannot fix and moves the backfill to ERROR.
     */
    public void fail(String message, Instant now) {
        recordError(message, now);
        transitionTo(BackfillStatus.ERROR);
    }

    @JsonIgnore
    public long getTotalDays() {
        return ChronoUnit.DAYS.between(rangeStart, rangeEnd) + 1;
    }

    /**
     * Completed days as a percentage of the range, with two decimals.
     */
    @JsonIgnore
    public String getPercentComplete() {
        BigDecimal percent = BigDecimal.valueOf(completedDates.size())
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(getTotalDays()), 2, RoundingMode.HALF_UP);
        return percent.toPlainString();
    }

    public List<LocalDate> getCompletedDates() {
        return Collections.unmodifiableList(completedDates);
    }

    public List<BackfillError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    private void transitionTo(BackfillStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalBackfillTransitionException(status, next);
        }
        this.status = next;
    }
}
