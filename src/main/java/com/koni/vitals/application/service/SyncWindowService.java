package com.koni.vitals.application.service;

import com.koni.vitals.application.port.SyncWindowPublisher;
import com.koni.vitals.domain.event.SyncWindowRequested;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Validates and enqueues explicit sync window requests.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncWindowService {
    
    static final Duration MAX_WINDOW = Duration.ofDays(1);
    
    private final SyncWindowPublisher publisher;
    private final SiteRegistry siteRegistry;
    private final Clock clock;
    
    /**
     * @throws ValidationException if the window is inverted, in the future or longer than a day
     * @throws com.koni.vitals.domain.exception.UnknownSiteException if the site is not registered
     */
    public SyncWindowRequested request(String site, Instant start, Instant end, List<String> pointNames) {
        siteRegistry.requireKnown(site);
        TimeWindow window = new TimeWindow(start, end);
        Instant now = clock.instant();
        if (window.getStart().isAfter(now)) {
            throw new ValidationException("window start " + start + " is in the future");
        }
        if (window.length().compareTo(MAX_WINDOW) > 0) {
            throw new ValidationException("window longer than " + MAX_WINDOW.toHours() + "h: " + window);
        }
        
        SyncWindowRequested request = new SyncWindowRequested(UUID.randomUUID(), site, start, end, pointNames, now);
        publisher.publish(request);
        log.info("Sync window requested: requestId={}, site={}, window={}", request.getRequestId(), site, window);
        return request;
    }
}
