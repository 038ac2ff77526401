package com.koni.vitals.application.backfill;

import com.koni.vitals.application.service.SiteRegistry;
import com.koni.vitals.domain.exception.TerminalApiException;
import com.koni.vitals.domain.exception.TransientApiException;
import com.koni.vitals.domain.exception.UnknownSiteException;
import com.koni.vitals.domain.model.BackfillDirection;
import com.koni.vitals.domain.model.BackfillState;
import com.koni.vitals.domain.model.BackfillStatus;
import com.koni.vitals.domain.model.ColdStoragePaths;
import com.koni.vitals.domain.model.PageQuery;
import com.koni.vitals.domain.model.Sample;
import com.koni.vitals.domain.model.SamplePage;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import com.koni.vitals.infrastructure.observability.PipelineMetrics;
import com.koni.vitals.infrastructure.persistence.state.JsonStateStore;
import com.koni.vitals.infrastructure.persistence.state.StateStoreRunLock;
import com.koni.vitals.infrastructure.storage.NdjsonGzipDayFileCodec;
import com.koni.vitals.support.InMemoryColdObjectStore;
import com.koni.vitals.support.InMemoryKeyValueStore;
import com.koni.vitals.support.MutableClock;
import com.koni.vitals.support.StubTimeseriesApi;
import com.koni.vitals.support.TestProperties;
import com.koni.vitals.tags.UnitTest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for BackfillEngine.
 * Each upstream day is served as two pages: the first carries cursor "c1", the second ends the day.
 */
@UnitTest
class BackfillEngineTest {
    
    private static final String SITE = "building-a";
    private static final LocalDate DAY_ONE = LocalDate.of(2024, 12, 10);
    private static final LocalDate DAY_TWO = LocalDate.of(2024, 12, 11);
    
    private MutableClock clock;
    private InMemoryKeyValueStore stateKv;
    private InMemoryKeyValueStore lockKv;
    private JsonStateStore stateStore;
    private StubTimeseriesApi api;
    private InMemoryColdObjectStore coldStore;
    private NdjsonGzipDayFileCodec codec;
    private SimpleMeterRegistry meterRegistry;
    
    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-15T12:00:00Z");
        stateKv = new InMemoryKeyValueStore(clock);
        lockKv = new InMemoryKeyValueStore(clock);
        stateStore = new JsonStateStore(stateKv, TestProperties.objectMapper());
        api = new StubTimeseriesApi();
        api.respondWith(BackfillEngineTest::twoPagesPerDay);
        coldStore = new InMemoryColdObjectStore();
        codec = new NdjsonGzipDayFileCodec(TestProperties.objectMapper());
        meterRegistry = new SimpleMeterRegistry();
    }
    
    private BackfillEngine engine(PipelineProperties properties) {
        return new BackfillEngine(api, coldStore, codec, stateStore,
                new StateStoreRunLock(lockKv, TestProperties.objectMapper(), clock),
                new SiteRegistry(stateStore, properties), new PipelineMetrics(meterRegistry), clock, properties);
    }
    
    private static TestProperties twoDays() {
        return TestProperties.builder().backfillRange(DAY_ONE, DAY_TWO).backfillSites(SITE);
    }
    
    private static SamplePage twoPagesPerDay(PageQuery query) {
        LocalDate day = query.getWindow().getStart().atZone(ZoneOffset.UTC).toLocalDate();
        long midnight = day.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        if (query.getCursor() == null) {
            return StubTimeseriesApi.page(
                    List.of(new Sample(query.getSite(), "ahu1/sat", midnight + 3_600_000L, 20.5)), "c1");
        }
        return StubTimeseriesApi.page(
                List.of(new Sample(query.getSite(), "ahu1/sat", midnight + 7_200_000L, 21.0)), null);
    }
    
    private static String dayFileKey(LocalDate day) {
        return ColdStoragePaths.objectKey(SITE, day, SITE, NdjsonGzipDayFileCodec.EXTENSION);
    }
    
    @Test
    void shouldCompleteTwoDayRangeWithinOneInvocation() {
        // Given
        BackfillEngine engine = engine(twoDays().pagesPerInvocation(5).build());
        
        // When
        BackfillResult result = engine.trigger(SITE, false);
        
        // Then: four pages, both days complete, nothing left to continue
        assertThat(result.getStatus()).isEqualTo("complete");
        assertThat(result.getPagesProcessed()).isEqualTo(4);
        assertThat(result.isContinuation()).isFalse();
        assertThat(result.getProgress().getCompletedDates()).containsExactly(DAY_ONE, DAY_TWO);
        assertThat(result.getProgress().getPercent()).isEqualTo("100.00");
        assertThat(api.getQueries()).extracting(PageQuery::getCursor).containsExactly(null, "c1", null, "c1");
        assertThat(meterRegistry.get("vitals.backfill.pages.total").counter().count()).isEqualTo(4.0);
    }
    
    @Test
    void shouldResumeFromStoredDayAndCursor() {
        // Given: an invocation that stops in the middle of the second day
        BackfillEngine engine = engine(twoDays().pagesPerInvocation(3).build());
        BackfillResult first = engine.trigger(SITE, false);
        
        assertThat(first.getStatus()).isEqualTo("in_progress");
        assertThat(first.isContinuation()).isTrue();
        assertThat(first.getProgress().getCurrentDate()).isEqualTo(DAY_TWO);
        assertThat(first.getProgress().getCurrentCursor()).isEqualTo("c1");
        assertThat(first.getProgress().getCompletedDates()).containsExactly(DAY_ONE);
        
        // When
        BackfillResult second = engine.trigger(SITE, false);
        
        // Then: the next request picks up the stored cursor of the same day
        assertThat(api.getQueries().get(3).getCursor()).isEqualTo("c1");
        assertThat(api.getQueries().get(3).getWindow().getStart())
                .isEqualTo(DAY_TWO.atStartOfDay(ZoneOffset.UTC).toInstant());
        assertThat(second.getStatus()).isEqualTo("complete");
        assertThat(second.getPagesProcessed()).isEqualTo(1);
        assertThat(second.getProgress().getCompletedDates()).containsExactly(DAY_ONE, DAY_TWO);
    }
    
    @Test
    void shouldNotAdvanceDayWhileCursorRemainsDespiteNoMoreDataFlag() {
        // Given: the first page of each day answers has_more=false but still carries a cursor
        api.respondWith(query -> {
            SamplePage page = twoPagesPerDay(query);
            return new SamplePage(page.getSamples(), page.getNextCursor(), false, 0);
        });
        BackfillEngine engine = engine(twoDays().pagesPerInvocation(1).build());
        
        // When
        BackfillResult result = engine.trigger(SITE, false);
        
        // Then
        assertThat(result.getStatus()).isEqualTo("in_progress");
        assertThat(result.getProgress().getCurrentDate()).isEqualTo(DAY_ONE);
        assertThat(result.getProgress().getCurrentCursor()).isEqualTo("c1");
        assertThat(result.getProgress().getCompletedDates()).isEmpty();
        assertThat(stateStore.findBackfillState(SITE).get().getCurrentCursor()).isEqualTo("c1");
    }
    
    @Test
    void shouldCompleteWithinThreeInvocationsOfTwoPages() {
        BackfillEngine engine = engine(twoDays().pagesPerInvocation(2).build());
        
        BackfillResult result = null;
        for (int i = 0; i < 3; i++) {
            result = engine.trigger(SITE, false);
        }
        
        assertThat(result.getStatus()).isEqualTo("complete");
        assertThat(api.getQueries()).hasSize(4);
    }
    
    @Test
    void shouldMergePagesIntoDayFiles() {
        BackfillEngine engine = engine(twoDays().build());
        
        engine.trigger(SITE, false);
        
        assertThat(coldStore.objects()).containsOnlyKeys(dayFileKey(DAY_ONE), dayFileKey(DAY_TWO));
        List<Sample> dayOne = codec.decode(SITE, coldStore.objects().get(dayFileKey(DAY_ONE)));
        assertThat(dayOne).extracting(Sample::getValue).containsExactly(20.5, 21.0);
    }
    
    @Test
    void shouldWalkNewestDayFirst() {
        BackfillEngine engine = engine(twoDays()
                .direction(BackfillDirection.NEWEST_FIRST)
                .pagesPerInvocation(1)
                .build());
        
        engine.trigger(SITE, false);
        
        assertThat(api.lastQuery().getWindow().getStart()).isEqualTo(DAY_TWO.atStartOfDay(ZoneOffset.UTC).toInstant());
    }
    
    @Test
    void shouldStopInErrorOnRejectedRequest() {
        // Given
        api.respondWith(query -> {
            throw new TerminalApiException(400, "invalid point filter");
        });
        BackfillEngine engine = engine(twoDays().build());
        
        // When
        BackfillResult result = engine.trigger(SITE, false);
        BackfillResult again = engine.trigger(SITE, false);
        
        // Then: the error is terminal and later invocations do not fetch
        assertThat(result.getStatus()).isEqualTo(BackfillResult.ERROR);
        assertThat(result.getErrors()).extracting("message").containsExactly("invalid point filter");
        assertThat(stateStore.findBackfillState(SITE)).map(BackfillState::getStatus).contains(BackfillStatus.ERROR);
        assertThat(again.getPagesProcessed()).isZero();
        assertThat(api.getQueries()).hasSize(1);
    }
    
    @Test
    void shouldKeepPositionOnTransientFailure() {
        // Given: the second page of the first day times out once
        api.respondWith(query -> {
            if ("c1".equals(query.getCursor())) {
                throw new TransientApiException("read timeout");
            }
            return twoPagesPerDay(query);
        });
        BackfillEngine engine = engine(twoDays().build());
        
        // When
        BackfillResult failed = engine.trigger(SITE, false);
        
        // Then
        assertThat(failed.getStatus()).isEqualTo(BackfillResult.ERROR);
        assertThat(failed.getPagesProcessed()).isEqualTo(1);
        BackfillState state = stateStore.findBackfillState(SITE).orElseThrow();
        assertThat(state.getStatus()).isEqualTo(BackfillStatus.IN_PROGRESS);
        assertThat(state.getCurrentDate()).isEqualTo(DAY_ONE);
        assertThat(state.getCurrentCursor()).isEqualTo("c1");
        assertThat(state.getErrors()).hasSize(1);
        
        // When: the upstream recovers
        api.respondWith(BackfillEngineTest::twoPagesPerDay);
        BackfillResult resumed = engine.trigger(SITE, false);
        
        // Then
        assertThat(resumed.getStatus()).isEqualTo("complete");
        assertThat(api.lastQuery().getWindow().getStart()).isEqualTo(DAY_TWO.atStartOfDay(ZoneOffset.UTC).toInstant());
    }
    
    @Test
    void shouldKeepPositionWhenDayFileUploadFails() {
        coldStore.failNextPuts(1);
        BackfillEngine engine = engine(twoDays().build());
        
        BackfillResult result = engine.trigger(SITE, false);
        
        assertThat(result.getStatus()).isEqualTo(BackfillResult.ERROR);
        BackfillState state = stateStore.findBackfillState(SITE).orElseThrow();
        assertThat(state.getCurrentCursor()).isNull();
        assertThat(state.getPagesFetched()).isZero();
    }
    
    @Test
    void shouldSkipWhileAnotherInvocationHoldsTheSite() {
        // Given
        BackfillEngine engine = engine(twoDays().build());
        new StateStoreRunLock(lockKv, TestProperties.objectMapper(), clock)
                .acquire("backfill:" + SITE, Duration.ofMinutes(5));
        
        // When
        BackfillResult result = engine.trigger(SITE, false);
        
        // Then
        assertThat(result.getStatus()).isEqualTo(BackfillResult.SKIPPED);
        assertThat(result.isContinuation()).isTrue();
        assertThat(api.getQueries()).isEmpty();
    }
    
    @Test
    void shouldRunAgainOnceTheLockExpires() {
        BackfillEngine engine = engine(twoDays().build());
        new StateStoreRunLock(lockKv, TestProperties.objectMapper(), clock)
                .acquire("backfill:" + SITE, Duration.ofMinutes(5));
        
        clock.advance(Duration.ofMinutes(6));
        BackfillResult result = engine.trigger(SITE, false);
        
        assertThat(result.getStatus()).isEqualTo("complete");
    }
    
    @Test
    void shouldStartOverOnReset() {
        BackfillEngine engine = engine(twoDays().build());
        engine.trigger(SITE, false);
        
        BackfillResult reset = engine.trigger(SITE, true);
        
        assertThat(reset.getStatus()).isEqualTo("complete");
        assertThat(reset.getPagesProcessed()).isEqualTo(4);
        assertThat(api.getQueries()).hasSize(8);
    }
    
    @Test
    void shouldRejectUnknownSite() {
        BackfillEngine engine = engine(twoDays().build());
        
        assertThatThrownBy(() -> engine.trigger("warehouse-9", false))
                .isInstanceOf(UnknownSiteException.class);
        assertThatThrownBy(() -> engine.status("warehouse-9"))
                .isInstanceOf(UnknownSiteException.class);
    }
    
    @Test
    void shouldReportNotStartedWithoutState() {
        BackfillEngine engine = engine(twoDays().build());
        
        BackfillResult status = engine.status(SITE);
        
        assertThat(status.getStatus()).isEqualTo("not_started");
        assertThat(status.getProgress().getTotalDays()).isEqualTo(2);
        assertThat(stateStore.findBackfillState(SITE)).isEmpty();
    }
    
    @Test
    void shouldContinueOnlyBackfillsInProgress() {
        // Given: one page per invocation, so the first trigger leaves the backfill in progress
        BackfillEngine engine = engine(twoDays().pagesPerInvocation(1).build());
        assertThat(engine.run()).isEmpty();
        engine.trigger(SITE, false);
        
        // When
        List<BackfillResult> results = engine.run();
        
        // Then
        assertThat(results).hasSize(1);
        assertThat(results.get(0).getProgress().getCompletedDates()).containsExactly(DAY_ONE);
    }
}
