package com.koni.vitals.support;

import com.koni.vitals.application.port.TimeseriesApi;
import com.koni.vitals.domain.model.PageQuery;
import com.koni.vitals.domain.model.Sample;
import com.koni.vitals.domain.model.SamplePage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Upstream API double that answers each query with a scripted page and records every query.
 */
public class StubTimeseriesApi implements TimeseriesApi {
    
    private final List<PageQuery> queries = new ArrayList<>();
    private Function<PageQuery, SamplePage> responder = query -> emptyPage();
    
    public static SamplePage emptyPage() {
        return new SamplePage(Collections.emptyList(), null, 0);
    }
    
    public static SamplePage page(List<Sample> samples, String nextCursor) {
        return new SamplePage(samples, nextCursor, 0);
    }
    
    public void respondWith(Function<PageQuery, SamplePage> responder) {
        this.responder = responder;
    }
    
    /**
     * Serves the samples of the store that fall inside the queried window, in one page.
     */
    public void serveFrom(List<Sample> upstream) {
        respondWith(query -> {
            List<Sample> matching = new ArrayList<>();
            for (Sample sample : upstream) {
                boolean pointMatches = query.getPointNames().isEmpty()
                        || query.getPointNames().contains(sample.getPointName());
                if (sample.getSite().equals(query.getSite()) && pointMatches
                        && query.getWindow().contains(sample.getTimestamp())) {
                    matching.add(sample);
                }
            }
            return page(matching, null);
        });
    }
    
    @Override
    public synchronized SamplePage fetchPage(PageQuery query) {
        queries.add(query);
        return responder.apply(query);
    }
    
    public synchronized List<PageQuery> getQueries() {
        return new ArrayList<>(queries);
    }
    
    public synchronized PageQuery lastQuery() {
        return queries.get(queries.size() - 1);
    }
}
