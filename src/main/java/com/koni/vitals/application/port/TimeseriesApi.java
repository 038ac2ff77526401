package com.koni.vitals.application.port;

import com.koni.vitals.domain.model.PageQuery;
import com.koni.vitals.domain.model.SamplePage;

/**
 * Port for the upstream cursor-paginated time series API.
 */
public interface TimeseriesApi {
    
    /**
     * Fetches one page of samples.
     * Null, NaN and non-numeric values are dropped before the page is returned.
     *
     * @param query site, window, cursor and optional point filter
     * @return the page, with a null next cursor when the window has no further pages
     * @throws com.koni.vitals.domain.exception.TransientApiException if the call still fails after retries
     * @throws com.koni.vitals.domain.exception.TerminalApiException if the API rejects the request
     */
    SamplePage fetchPage(PageQuery query);
}
