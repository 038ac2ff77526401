package com.koni.vitals.application.sync;

import com.koni.vitals.application.port.TimeseriesApi;
import com.koni.vitals.domain.model.PageQuery;
import com.koni.vitals.domain.model.Sample;
import com.koni.vitals.domain.model.SamplePage;
import com.koni.vitals.domain.model.TimeWindow;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fetches every page of a window from the upstream API.
 *
 * Point filters are sent in chunks of {@code vitals.api.point-chunk-size}. With
 * {@code vitals.api.omit-point-filter} the filter is not sent and samples are filtered here.
 * Pagination of one request stops after {@code vitals.api.max-pages-per-window} pages, or
 * when the API reports {@code has_more=false}; the next cycle's lookback re-reads the window.
 */
@Slf4j
@Component
public class WindowFetcher {
    
    private final TimeseriesApi api;
    private final PipelineProperties.Api apiProperties;
    
    public WindowFetcher(TimeseriesApi api, PipelineProperties properties) {
        this.api = api;
        this.apiProperties = properties.getApi();
    }
    
    public FetchResult fetch(String site, TimeWindow window, List<String> pointNames) {
        return fetch(site, window, pointNames, apiProperties.getPageSize());
    }
    
    public FetchResult fetch(String site, TimeWindow window, List<String> pointNames, int pageSize) {
        List<String> points = pointNames == null ? Collections.emptyList() : pointNames;
        
        List<Sample> samples = new ArrayList<>();
        int dropped = 0;
        int pages = 0;
        boolean truncated = false;
        
        for (List<String> chunk : requestChunks(points)) {
            PageQuery query = new PageQuery(site, window, null, chunk, pageSize);
            int chunkPages = 0;
            while (true) {
                SamplePage page = api.fetchPage(query);
                chunkPages++;
                samples.addAll(page.getSamples());
                dropped += page.getDroppedCount();
                if (page.isLastPage()) {
                    break;
                }
                if (!page.isMoreAvailable()) {
                    log.debug("Upstream reports no more data, ignoring cursor: site={}, window={}", site, window);
                    break;
                }
                if (chunkPages >= apiProperties.getMaxPagesPerWindow()) {
                    log.warn("Page guard reached, stopping pagination: site={}, window={}, pages={}",
                            site, window, chunkPages);
                    truncated = true;
                    break;
                }
                query = query.withCursor(page.getNextCursor());
            }
            pages += chunkPages;
        }
        
        if (apiProperties.isOmitPointFilter() && !points.isEmpty()) {
            Set<String> wanted = new HashSet<>(points);
            List<Sample> filtered = new ArrayList<>(samples.size());
            for (Sample sample : samples) {
                if (wanted.contains(sample.getPointName())) {
                    filtered.add(sample);
                }
            }
            samples = filtered;
        }
        
        log.debug("Fetched window: site={}, window={}, samples={}, dropped={}, pages={}",
                site, window, samples.size(), dropped, pages);
        return new FetchResult(samples, dropped, pages, truncated);
    }
    
    /**
     * Point filters per request; a single empty filter when no filter is sent.
     */
    List<List<String>> requestChunks(List<String> points) {
        if (points.isEmpty() || apiProperties.isOmitPointFilter()) {
            return Collections.singletonList(Collections.emptyList());
        }
        int size = apiProperties.getPointChunkSize();
        List<List<String>> chunks = new ArrayList<>();
        for (int from = 0; from < points.size(); from += size) {
            chunks.add(points.subList(from, Math.min(from + size, points.size())));
        }
        return chunks;
    }
}
