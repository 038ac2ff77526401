package com.koni.vitals.application.consumer;

import com.koni.vitals.application.port.RunLock;
import com.koni.vitals.application.service.SiteRegistry;
import com.koni.vitals.application.sync.FetchResult;
import com.koni.vitals.application.sync.WindowFetcher;
import com.koni.vitals.domain.event.SyncWindowRequested;
import com.koni.vitals.domain.exception.SiteBusyException;
import com.koni.vitals.domain.model.TimeWindow;
import com.koni.vitals.domain.repository.HotSampleRepository;
import com.koni.vitals.domain.repository.StateStore;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import com.koni.vitals.infrastructure.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * SyncWindowConsumer ingests explicitly requested windows from the sync window queue.
 *
 * Key responsibilities:
 * - Skip windows whose done marker exists
 * - Hold the per-site window lock while fetching, and rethrow when another consumer holds it
 *   so the delivery is retried with backoff
 * - Upsert the fetched samples and write the done marker
 * - Manually commit Kafka offsets after successful processing
 *
 * The incremental sync position is never touched here.
 */
@Slf4j
@Service
public class SyncWindowConsumer {
    
    private final WindowFetcher fetcher;
    private final HotSampleRepository hotSamples;
    private final StateStore stateStore;
    private final RunLock runLock;
    private final SiteRegistry siteRegistry;
    private final PipelineMetrics metrics;
    private final PipelineProperties.Kafka kafka;
    
    public SyncWindowConsumer(WindowFetcher fetcher, HotSampleRepository hotSamples, StateStore stateStore,
                              RunLock runLock, SiteRegistry siteRegistry, PipelineMetrics metrics,
                              PipelineProperties properties) {
        this.fetcher = fetcher;
        this.hotSamples = hotSamples;
        this.stateStore = stateStore;
        this.runLock = runLock;
        this.siteRegistry = siteRegistry;
        this.metrics = metrics;
        this.kafka = properties.getKafka();
    }
    
    @KafkaListener(
            topics = "${vitals.kafka.windows-topic:vitals.sync.windows}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(SyncWindowRequested request, Acknowledgment acknowledgment) {
        log.debug("Received SyncWindowRequested: {}", request);
        try {
            process(request);
            acknowledgment.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing sync window: requestId={}, site={}",
                    request.getRequestId(), request.getSite(), e);
            throw e;
        }
    }
    
    /**
     * Ingests one requested window.
     *
     * @return the number of samples written, 0 when the window was already done
     * @throws SiteBusyException if another consumer is ingesting a window of the same site
     */
    public int process(SyncWindowRequested request) {
        siteRegistry.requireKnown(request.getSite());
        TimeWindow window = new TimeWindow(request.getStart(), request.getEnd());
        String doneKey = request.doneKey();
        
        if (stateStore.isWindowDone(doneKey)) {
            log.info("Sync window already ingested, skipping: site={}, window={}", request.getSite(), window);
            return 0;
        }
        
        String scope = "window:" + request.getSite();
        Optional<String> lease = runLock.acquire(scope, kafka.getWindowLockTtl());
        if (lease.isEmpty()) {
            throw new SiteBusyException("Site busy, window will be retried: " + request.getSite());
        }
        try {
            FetchResult fetched = fetcher.fetch(request.getSite(), window, request.getPointNames());
            int written = hotSamples.upsertAll(fetched.getSamples());
            metrics.recordSamplesWritten(written);
            metrics.recordSamplesDropped(fetched.getDroppedCount());
            stateStore.markWindowDone(doneKey, kafka.getDoneMarkerTtl());
            
            log.info("Sync window ingested: site={}, window={}, written={}, dropped={}, pages={}",
                    request.getSite(), window, written, fetched.getDroppedCount(), fetched.getPagesFetched());
            return written;
        } finally {
            runLock.release(scope, lease.get());
        }
    }
}
