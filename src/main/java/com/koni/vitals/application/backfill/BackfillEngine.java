package com.koni.vitals.application.backfill;

import com.koni.vitals.application.port.ColdObjectStore;
import com.koni.vitals.application.port.DayFileCodec;
import com.koni.vitals.application.port.RunLock;
import com.koni.vitals.application.port.TimeseriesApi;
import com.koni.vitals.application.service.PipelineWorker;
import com.koni.vitals.application.service.SiteRegistry;
import com.koni.vitals.domain.exception.ColdStorageException;
import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.exception.TerminalApiException;
import com.koni.vitals.domain.exception.TransientApiException;
import com.koni.vitals.domain.exception.UnknownSiteException;
import com.koni.vitals.domain.model.BackfillState;
import com.koni.vitals.domain.model.BackfillStatus;
import com.koni.vitals.domain.model.ColdStoragePaths;
import com.koni.vitals.domain.model.PageQuery;
import com.koni.vitals.domain.model.Sample;
import com.koni.vitals.domain.model.SamplePage;
import com.koni.vitals.domain.model.TimeWindow;
import com.koni.vitals.domain.repository.StateStore;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import com.koni.vitals.infrastructure.observability.PipelineMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Continuation-based historical backfill.
 *
 * Each invocation processes at most {@code vitals.backfill.pages-per-invocation} pages for a
 * site and checkpoints the state after every page, so an invocation can end at any point and
 * the next one resumes from the stored (day, cursor). Pages are merged into per-site day files
 * in cold storage.
 */
@Slf4j
@Service
public class BackfillEngine implements PipelineWorker<List<BackfillResult>> {
    
    private static final Duration LOCK_TTL = Duration.ofMinutes(5);
    
    private final TimeseriesApi api;
    private final ColdObjectStore coldStore;
    private final DayFileCodec dayFileCodec;
    private final StateStore stateStore;
    private final RunLock runLock;
    private final SiteRegistry siteRegistry;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final PipelineProperties.Backfill backfill;
    private final List<String> pointNames;
    
    public BackfillEngine(TimeseriesApi api, ColdObjectStore coldStore, DayFileCodec dayFileCodec,
                          StateStore stateStore, RunLock runLock, SiteRegistry siteRegistry,
                          PipelineMetrics metrics, Clock clock, PipelineProperties properties) {
        this.api = api;
        this.coldStore = coldStore;
        this.dayFileCodec = dayFileCodec;
        this.stateStore = stateStore;
        this.runLock = runLock;
        this.siteRegistry = siteRegistry;
        this.metrics = metrics;
        this.clock = clock;
        this.backfill = properties.getBackfill();
        this.pointNames = properties.getSync().getPointNames();
    }
    
    @Override
    public String name() {
        return "backfill";
    }
    
    /**
     * Continues every configured backfill that is in progress.
     */
    @Override
    public List<BackfillResult> run() {
        List<BackfillResult> results = new ArrayList<>();
        for (String site : backfill.getSites()) {
            Optional<BackfillState> state = stateStore.findBackfillState(site);
            if (state.isEmpty() || state.get().getStatus() != BackfillStatus.IN_PROGRESS) {
                continue;
            }
            try {
                results.add(trigger(site, false));
            } catch (StateStoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Scheduled backfill failed: site={}, error={}", site, e.getMessage(), e);
            }
        }
        return results;
    }
    
    /**
     * Starts, continues or restarts the backfill of one site.
     *
     * @param reset discard the stored state and start over from the first day
     * @throws UnknownSiteException if the site is neither registered nor configured for backfill
     */
    @Observed(name = "backfill.trigger", contextualName = "backfill-trigger")
    public BackfillResult trigger(String site, boolean reset) {
        requireKnown(site);
        String scope = "backfill:" + site;
        Optional<String> lease = runLock.acquire(scope, LOCK_TTL);
        if (lease.isEmpty()) {
            BackfillState current = stateStore.findBackfillState(site).orElseGet(() -> newState(site));
            log.info("Backfill skipped, lock held: site={}", site);
            return new BackfillResult(BackfillResult.SKIPPED, site, new BackfillProgress(current), 0, true,
                    current.getErrors());
        }
        try {
            return process(site, reset);
        } finally {
            runLock.release(scope, lease.get());
        }
    }
    
    private BackfillResult process(String site, boolean reset) {
        BackfillState state = reset ? null : stateStore.findBackfillState(site).orElse(null);
        if (state == null) {
            state = newState(site);
            log.info("Backfill state created: site={}, range={}..{}, direction={}, reset={}",
                    site, state.getRangeStart(), state.getRangeEnd(), state.getDirection(), reset);
        }
        
        if (state.getStatus().isTerminal()) {
            log.info("Backfill already finished: site={}, status={}", site, state.getStatus().wireValue());
            return BackfillResult.of(state, 0, false);
        }
        if (state.getStatus() == BackfillStatus.NOT_STARTED) {
            state.start(clock.instant());
            stateStore.saveBackfillState(state);
        }
        
        int pages = 0;
        while (pages < backfill.getPagesPerInvocation() && state.getStatus() == BackfillStatus.IN_PROGRESS) {
            LocalDate day = state.getCurrentDate();
            PageQuery query = new PageQuery(site, TimeWindow.forDay(day), state.getCurrentCursor(),
                    pointNames, backfill.getPageSize());
            try {
                SamplePage page = api.fetchPage(query);
                writeDayFiles(site, page.getSamples());
                state.recordPage(page.getSamples().size(), page.getNextCursor(), clock.instant());
                stateStore.saveBackfillState(state);
                pages++;
                metrics.recordBackfillPage();
                metrics.recordSamplesDropped(page.getDroppedCount());
                log.info("Backfill page processed: site={}, date={}, samples={}, dayComplete={}",
                        site, day, page.getSamples().size(), page.isLastPage());
            } catch (TerminalApiException e) {
                log.error("Backfill stopped on rejected request: site={}, date={}, status={}",
                        site, day, e.getStatusCode(), e);
                state.fail(e.getMessage(), clock.instant());
                stateStore.saveBackfillState(state);
                return BackfillResult.failed(state, pages);
            } catch (TransientApiException | ColdStorageException e) {
                log.warn("Backfill page failed, will retry next invocation: site={}, date={}, error={}",
                        site, day, e.getMessage());
                state.recordError(e.getMessage(), clock.instant());
                stateStore.saveBackfillState(state);
                return BackfillResult.failed(state, pages);
            }
        }
        
        boolean continuation = state.getStatus() == BackfillStatus.IN_PROGRESS;
        log.info("Backfill invocation finished: site={}, pages={}, status={}, percent={}",
                site, pages, state.getStatus().wireValue(), state.getPercentComplete());
        return BackfillResult.of(state, pages, continuation);
    }
    
    /**
     * Current progress of a site's backfill without changing it.
     */
    public BackfillResult status(String site) {
        requireKnown(site);
        BackfillState state = stateStore.findBackfillState(site).orElseGet(() -> newState(site));
        return BackfillResult.of(state, 0, state.getStatus() == BackfillStatus.IN_PROGRESS);
    }
    
    /**
     * Merges samples into their per-site day files, grouped by UTC day.
     */
    private void writeDayFiles(String site, List<Sample> samples) {
        if (samples.isEmpty()) {
            return;
        }
        Map<LocalDate, List<Sample>> byDay = new TreeMap<>();
        for (Sample sample : samples) {
            LocalDate day = sample.instant().atZone(ZoneOffset.UTC).toLocalDate();
            byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(sample);
        }
        for (Map.Entry<LocalDate, List<Sample>> entry : byDay.entrySet()) {
            String key = ColdStoragePaths.objectKey(site, entry.getKey(), site, dayFileCodec.extension());
            byte[] existing = coldStore.get(key).orElse(null);
            byte[] merged = dayFileCodec.merge(existing, entry.getValue());
            coldStore.put(key, merged, dayFileCodec.contentType());
        }
    }
    
    private BackfillState newState(String site) {
        return BackfillState.create(site, backfill.getRangeStart(), backfill.getRangeEnd(),
                backfill.getDirection(), clock.instant());
    }
    
    private void requireKnown(String site) {
        if (site == null || !(backfill.getSites().contains(site) || siteRegistry.isKnown(site))) {
            throw new UnknownSiteException("Unknown site: " + site);
        }
    }
    
    @Override
    public Map<String, Object> describe() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("rangeStart", backfill.getRangeStart().toString());
        config.put("rangeEnd", backfill.getRangeEnd().toString());
        config.put("direction", backfill.getDirection().name());
        config.put("pagesPerInvocation", backfill.getPagesPerInvocation());
        config.put("pageSize", backfill.getPageSize());
        config.put("sites", backfill.getSites());
        return config;
    }
}
