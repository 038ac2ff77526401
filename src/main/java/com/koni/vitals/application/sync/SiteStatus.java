package com.koni.vitals.application.sync;

import com.koni.vitals.domain.model.Freshness;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Sync position and freshness of one site, as reported by the status endpoint.
 */
@Getter
@ToString
@AllArgsConstructor
public class SiteStatus {
    
    private final String site;
    private final Long lastSyncTimestamp;
    private final Long dataAgeSeconds;
    private final Freshness freshness;
}
