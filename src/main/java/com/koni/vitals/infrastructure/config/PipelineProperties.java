package com.koni.vitals.infrastructure.config;

import com.koni.vitals.domain.model.BackfillDirection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * Immutable pipeline configuration bound from the {@code vitals.*} properties.
 *
 * Every value has a default applied in the constructors, so a section missing from the
 * configuration source still yields a complete object. Workers receive this object at
 * construction time and never read configuration from anywhere else.
 */
@Getter
@ToString
@Validated
@ConfigurationProperties(prefix = "vitals")
public class PipelineProperties {

    private final List<String> sites;

    @Valid
    private final Api api;

    @Valid
    private final Sync sync;

    @Valid
    private final Backfill backfill;

    @Valid
    private final Archive archive;

    @Valid
    private final ColdStore coldStore;

    @Valid
    private final Kafka kafka;

    @Valid
    private final Scheduling scheduling;

    public PipelineProperties(List<String> sites, Api api, Sync sync, Backfill backfill, Archive archive,
                              ColdStore coldStore, Kafka kafka, Scheduling scheduling) {
        this.sites = sites == null ? Collections.emptyList() : List.copyOf(sites);
        this.api = api == null ? Api.defaults() : api;
        this.sync = sync == null ? Sync.defaults() : sync;
        this.backfill = backfill == null ? Backfill.defaults() : backfill;
        this.archive = archive == null ? Archive.defaults() : archive;
        this.coldStore = coldStore == null ? ColdStore.defaults() : coldStore;
        this.kafka = kafka == null ? Kafka.defaults() : kafka;
        this.scheduling = scheduling == null ? Scheduling.defaults() : scheduling;
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null, null, null, null, null);
    }

    /**
     * Upstream time series API client settings.
     */
    @Getter
    @ToString(exclude = "token")
    public static class Api {

        private final String baseUrl;
        private final String token;

        @NotNull
        private final Duration connectTimeout;

        @NotNull
        private final Duration readTimeout;

        @Positive
        private final int pageSize;

        @Positive
        private final int pointChunkSize;

        private final boolean omitPointFilter;

        @Positive
        private final int maxPagesPerWindow;

        @Min(1)
        private final int maxAttempts;

        @NotNull
        private final Duration initialBackoff;

        public Api(String baseUrl, String token, Duration connectTimeout, Duration readTimeout, Integer pageSize,
                   Integer pointChunkSize, Boolean omitPointFilter, Integer maxPagesPerWindow, Integer maxAttempts,
                   Duration initialBackoff) {
            this.baseUrl = baseUrl == null ? "https://flightdeck.aceiot.cloud/api" : baseUrl;
            this.token = token == null ? "" : token;
            this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
            this.readTimeout = readTimeout == null ? Duration.ofSeconds(60) : readTimeout;
            this.pageSize = pageSize == null ? 100_000 : pageSize;
            this.pointChunkSize = pointChunkSize == null ? 400 : pointChunkSize;
            this.omitPointFilter = omitPointFilter == null ? false : omitPointFilter;
            this.maxPagesPerWindow = maxPagesPerWindow == null ? 200 : maxPagesPerWindow;
            this.maxAttempts = maxAttempts == null ? 3 : maxAttempts;
            this.initialBackoff = initialBackoff == null ? Duration.ofSeconds(2) : initialBackoff;
        }

        public static Api defaults() {
            return new Api(null, null, null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Sync orchestrator, site selection and catch-up settings.
     */
    @Getter
    @ToString
    public static class Sync {

        @Positive
        private final int maxSitesPerRun;

        private final Duration urgentAge;
        private final Duration skipIfFresherThan;
        private final Duration targetLag;

        @Min(0)
        private final int maxCatchUpCycles;

        private final Duration catchUpBudget;
        private final Duration firstSyncWindow;
        private final Duration staleStateThreshold;
        private final Duration lookback;
        private final Duration maxWindow;
        private final Duration lockTtl;
        private final Duration invocationBudget;
        private final boolean refillEnabled;
        private final Duration refillWindow;

        @Positive
        private final int shardCount;

        @Min(0)
        private final int shardIndex;

        @Min(1)
        @Max(32)
        private final int siteParallelism;

        private final List<String> pointNames;

        public Sync(Integer maxSitesPerRun, Duration urgentAge, Duration skipIfFresherThan, Duration targetLag,
                    Integer maxCatchUpCycles, Duration catchUpBudget, Duration firstSyncWindow,
                    Duration staleStateThreshold, Duration lookback, Duration maxWindow, Duration lockTtl,
                    Duration invocationBudget, Boolean refillEnabled, Duration refillWindow, Integer shardCount,
                    Integer shardIndex, Integer siteParallelism, List<String> pointNames) {
            this.maxSitesPerRun = maxSitesPerRun == null ? 6 : maxSitesPerRun;
            this.urgentAge = urgentAge == null ? Duration.ofSeconds(300) : urgentAge;
            this.skipIfFresherThan = skipIfFresherThan == null ? Duration.ofSeconds(60) : skipIfFresherThan;
            this.targetLag = targetLag == null ? Duration.ofSeconds(90) : targetLag;
            this.maxCatchUpCycles = maxCatchUpCycles == null ? 20 : maxCatchUpCycles;
            this.catchUpBudget = catchUpBudget == null ? Duration.ofSeconds(90) : catchUpBudget;
            this.firstSyncWindow = firstSyncWindow == null ? Duration.ofHours(24) : firstSyncWindow;
            this.staleStateThreshold = staleStateThreshold == null ? Duration.ofDays(7) : staleStateThreshold;
            this.lookback = lookback == null ? Duration.ofMinutes(10) : lookback;
            this.maxWindow = maxWindow == null ? Duration.ofMinutes(30) : maxWindow;
            this.lockTtl = lockTtl == null ? Duration.ofSeconds(120) : lockTtl;
            this.invocationBudget = invocationBudget == null ? Duration.ofSeconds(180) : invocationBudget;
            this.refillEnabled = refillEnabled == null ? true : refillEnabled;
            this.refillWindow = refillWindow == null ? Duration.ofMinutes(60) : refillWindow;
            this.shardCount = shardCount == null ? 1 : shardCount;
            this.shardIndex = shardIndex == null ? 0 : shardIndex;
            this.siteParallelism = siteParallelism == null ? 1 : siteParallelism;
            this.pointNames = pointNames == null ? Collections.emptyList() : List.copyOf(pointNames);
        }

        public static Sync defaults() {
            return new Sync(null, null, null, null, null, null, null, null, null, null, null, null, null, null,
                    null, null, null, null);
        }

        public String lockScope() {
            return "sync:" + shardCount + ":" + shardIndex;
        }

        /**
         * The run lock outlives the longest run: the invocation budget plus one site's catch-up
         * budget, or the configured TTL if that is longer.
         */
        public Duration effectiveLockTtl() {
            Duration longestRun = invocationBudget.plus(catchUpBudget);
            return lockTtl.compareTo(longestRun) >= 0 ? lockTtl : longestRun;
        }
    }

    /**
     * Historical backfill settings.
     */
    @Getter
    @ToString
    public static class Backfill {

        @NotNull
        private final LocalDate rangeStart;

        @NotNull
        private final LocalDate rangeEnd;

        @Positive
        private final int pagesPerInvocation;

        @Positive
        private final int pageSize;

        @NotNull
        private final BackfillDirection direction;

        private final List<String> sites;

        public Backfill(LocalDate rangeStart, LocalDate rangeEnd, Integer pagesPerInvocation, Integer pageSize,
                        BackfillDirection direction, List<String> sites) {
            this.rangeStart = rangeStart == null ? LocalDate.of(2024, 12, 10) : rangeStart;
            this.rangeEnd = rangeEnd == null ? LocalDate.of(2025, 10, 12) : rangeEnd;
            this.pagesPerInvocation = pagesPerInvocation == null ? 5 : pagesPerInvocation;
            this.pageSize = pageSize == null ? 100_000 : pageSize;
            this.direction = direction == null ? BackfillDirection.OLDEST_FIRST : direction;
            this.sites = sites == null ? Collections.emptyList() : List.copyOf(sites);
        }

        public static Backfill defaults() {
            return new Backfill(null, null, null, null, null, null);
        }
    }

    /**
     * Hot-to-cold archival settings.
     */
    @Getter
    @ToString
    public static class Archive {

        @Min(1)
        private final int retentionDays;

        @Positive
        private final int batchSize;

        @Min(1)
        private final int uploadAttempts;

        @NotNull
        private final Duration uploadBackoff;

        public Archive(Integer retentionDays, Integer batchSize, Integer uploadAttempts, Duration uploadBackoff) {
            this.retentionDays = retentionDays == null ? 20 : retentionDays;
            this.batchSize = batchSize == null ? 100_000 : batchSize;
            this.uploadAttempts = uploadAttempts == null ? 3 : uploadAttempts;
            this.uploadBackoff = uploadBackoff == null ? Duration.ofSeconds(2) : uploadBackoff;
        }

        public static Archive defaults() {
            return new Archive(null, null, null, null);
        }
    }

    /**
     * Filesystem cold store location.
     */
    @Getter
    @ToString
    public static class ColdStore {

        @NotNull
        private final Path root;

        public ColdStore(Path root) {
            this.root = root == null ? Path.of("data", "cold") : root;
        }

        public static ColdStore defaults() {
            return new ColdStore(null);
        }
    }

    /**
     * Sync window queue settings.
     */
    @Getter
    @ToString
    public static class Kafka {

        private final String windowsTopic;
        private final String deadLetterTopic;

        @Positive
        private final int partitions;

        @Positive
        private final short replicationFactor;

        private final boolean listenerAutoStartup;
        private final Duration sendTimeout;
        private final Duration windowLockTtl;
        private final Duration doneMarkerTtl;

        public Kafka(String windowsTopic, String deadLetterTopic, Integer partitions, Short replicationFactor,
                     Boolean listenerAutoStartup, Duration sendTimeout, Duration windowLockTtl,
                     Duration doneMarkerTtl) {
            this.windowsTopic = windowsTopic == null ? "vitals.sync.windows" : windowsTopic;
            this.deadLetterTopic = deadLetterTopic == null ? this.windowsTopic + ".dlq" : deadLetterTopic;
            this.partitions = partitions == null ? 3 : partitions;
            this.replicationFactor = replicationFactor == null ? (short) 1 : replicationFactor;
            this.listenerAutoStartup = listenerAutoStartup == null ? true : listenerAutoStartup;
            this.sendTimeout = sendTimeout == null ? Duration.ofSeconds(10) : sendTimeout;
            this.windowLockTtl = windowLockTtl == null ? Duration.ofMinutes(5) : windowLockTtl;
            this.doneMarkerTtl = doneMarkerTtl == null ? Duration.ofDays(7) : doneMarkerTtl;
        }

        public static Kafka defaults() {
            return new Kafka(null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Cron expressions of the scheduled entry points.
     */
    @Getter
    @ToString
    public static class Scheduling {

        private final boolean enabled;
        private final String syncCron;
        private final String backfillCron;
        private final String archiveCron;
        private final String purgeCron;

        public Scheduling(Boolean enabled, String syncCron, String backfillCron, String archiveCron,
                          String purgeCron) {
            this.enabled = enabled == null ? true : enabled;
            this.syncCron = syncCron == null ? "0 * * * * *" : syncCron;
            this.backfillCron = backfillCron == null ? "30 */5 * * * *" : backfillCron;
            this.archiveCron = archiveCron == null ? "0 0 2 * * *" : archiveCron;
            this.purgeCron = purgeCron == null ? "0 30 3 * * *" : purgeCron;
        }

        public static Scheduling defaults() {
            return new Scheduling(null, null, null, null, null);
        }
    }
}
