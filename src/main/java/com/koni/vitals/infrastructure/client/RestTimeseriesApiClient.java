package com.koni.vitals.infrastructure.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.koni.vitals.application.port.TimeseriesApi;
import com.koni.vitals.domain.exception.TerminalApiException;
import com.koni.vitals.domain.exception.TransientApiException;
import com.koni.vitals.domain.model.PageQuery;
import com.koni.vitals.domain.model.Sample;
import com.koni.vitals.domain.model.SamplePage;
import com.koni.vitals.infrastructure.client.dto.PaginatedTimeseriesResponse;
import com.koni.vitals.infrastructure.client.dto.PointSample;
import com.koni.vitals.infrastructure.observability.PipelineMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * RestClient implementation of the TimeseriesApi port.
 *
 * Each page request is retried on transient failures (I/O errors, 5xx, 429) and guarded by
 * the {@code timeseries-api} circuit breaker. Any other 4xx fails immediately.
 */
@Slf4j
@Component
public class RestTimeseriesApiClient implements TimeseriesApi {
    
    static final String PAGINATED_PATH = "/sites/{site}/timeseries/paginated";
    
    private final RestClient restClient;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final PipelineMetrics metrics;
    
    public RestTimeseriesApiClient(
            RestClient timeseriesRestClient,
            @Qualifier("timeseriesApiRetry") Retry timeseriesApiRetry,
            @Qualifier("timeseriesApiCircuitBreaker") CircuitBreaker timeseriesApiCircuitBreaker,
            PipelineMetrics metrics) {
        this.restClient = timeseriesRestClient;
        this.retry = timeseriesApiRetry;
        this.circuitBreaker = timeseriesApiCircuitBreaker;
        this.metrics = metrics;
    }
    
    @Override
    @Observed(name = "api.fetch_page", contextualName = "timeseries-fetch-page")
    public SamplePage fetchPage(PageQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        
        Supplier<PaginatedTimeseriesResponse> call = () -> execute(query);
        Supplier<PaginatedTimeseriesResponse> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker, Retry.decorateSupplier(retry, call));
        
        PaginatedTimeseriesResponse response;
        try {
            response = decorated.get();
        } catch (CallNotPermittedException e) {
            throw new TransientApiException("Circuit breaker is open for site " + query.getSite(), e);
        }
        
        metrics.recordApiPage();
        return toPage(query, response);
    }
    
    private PaginatedTimeseriesResponse execute(PageQuery query) {
        try {
            PaginatedTimeseriesResponse response = restClient.get()
                    .uri(builder -> buildUri(builder, query))
                    .retrieve()
                    .body(PaginatedTimeseriesResponse.class);
            if (response == null) {
                throw new TransientApiException("Empty response body for site " + query.getSite());
            }
            return response;
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new TransientApiException("Rate limited by upstream API for site " + query.getSite(), e);
            }
            throw new TerminalApiException(e.getStatusCode().value(),
                    "Upstream API rejected request for site " + query.getSite() + ": " + e.getStatusCode(), e);
        } catch (HttpServerErrorException e) {
            throw new TransientApiException(
                    "Upstream API error for site " + query.getSite() + ": " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new TransientApiException("Upstream API unreachable for site " + query.getSite(), e);
        } catch (RestClientException e) {
            throw new TransientApiException("Unreadable upstream response for site " + query.getSite(), e);
        }
    }
    
    private URI buildUri(UriBuilder builder, PageQuery query) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("site", query.getSite());
        variables.put("start", query.getWindow().startIso());
        variables.put("end", query.getWindow().endIso());
        variables.put("pageSize", query.getPageSize());
        
        builder.path(PAGINATED_PATH)
                .queryParam("start_time", "{start}")
                .queryParam("end_time", "{end}")
                .queryParam("page_size", "{pageSize}")
                .queryParam("raw_data", "true");
        if (query.getCursor() != null) {
            builder.queryParam("cursor", "{cursor}");
            variables.put("cursor", query.getCursor());
        }
        if (!query.getPointNames().isEmpty()) {
            builder.queryParam("point_names", "{pointNames}");
            variables.put("pointNames", String.join(",", query.getPointNames()));
        }
        return builder.build(variables);
    }
    
    /**
     * Normalizes a response into samples. A blank cursor is treated as no cursor; a non-blank
     * cursor is kept even when {@code has_more} is false.
     */
    SamplePage toPage(PageQuery query, PaginatedTimeseriesResponse response) {
        List<Sample> samples = new ArrayList<>(response.getPointSamples().size());
        int dropped = 0;
        for (PointSample raw : response.getPointSamples()) {
            Sample sample = normalize(query.getSite(), raw);
            if (sample == null) {
                dropped++;
            } else {
                samples.add(sample);
            }
        }
        
        String nextCursor = response.getNextCursor();
        if (nextCursor != null && nextCursor.isBlank()) {
            nextCursor = null;
        }
        if (nextCursor != null && !response.isHasMore()) {
            log.debug("Cursor returned with has_more=false: site={}, window={}", query.getSite(), query.getWindow());
        }
        
        if (dropped > 0) {
            log.debug("Dropped invalid samples: site={}, dropped={}, kept={}", query.getSite(), dropped, samples.size());
        }
        return new SamplePage(samples, nextCursor, response.isHasMore(), dropped);
    }
    
    private Sample normalize(String site, PointSample raw) {
        if (raw.getName() == null || raw.getName().isBlank() || raw.getTime() == null) {
            return null;
        }
        Double value = parseValue(raw.getValue());
        if (value == null) {
            return null;
        }
        Long timestamp = parseTime(raw.getTime());
        if (timestamp == null) {
            return null;
        }
        return new Sample(site, raw.getName(), timestamp, value);
    }
    
    private Double parseValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }
    
    private Long parseTime(String time) {
        try {
            return Instant.parse(time).toEpochMilli();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(time).toInstant().toEpochMilli();
            } catch (DateTimeParseException ignored) {
                log.debug("Dropping sample with unparseable time={}", time);
                return null;
            }
        }
    }
}
