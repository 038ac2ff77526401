package com.koni.vitals.application.sync;

import com.koni.vitals.domain.model.TimeWindow;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one sync cycle of one site.
 */
@Getter
@ToString
public class SyncCycleResult {
    
    private final String site;
    private final TimeWindow window;
    private final int samplesWritten;
    private final int samplesDropped;
    private final Long previousTimestamp;
    private final Long lastSyncTimestamp;
    private final boolean emptyWindowSkipped;
    
    public SyncCycleResult(String site, TimeWindow window, int samplesWritten, int samplesDropped,
                           Long previousTimestamp, Long lastSyncTimestamp) {
        this(site, window, samplesWritten, samplesDropped, previousTimestamp, lastSyncTimestamp, false);
    }
    
    /**
     * @param emptyWindowSkipped the scan position moved past a capped window with nothing new
     */
    public SyncCycleResult(String site, TimeWindow window, int samplesWritten, int samplesDropped,
                           Long previousTimestamp, Long lastSyncTimestamp, boolean emptyWindowSkipped) {
        this.site = site;
        this.window = window;
        this.samplesWritten = samplesWritten;
        this.samplesDropped = samplesDropped;
        this.previousTimestamp = previousTimestamp;
        this.lastSyncTimestamp = lastSyncTimestamp;
        this.emptyWindowSkipped = emptyWindowSkipped;
    }
    
    /**
     * True when the cycle moved the sync position forward.
     */
    public boolean isAdvanced() {
        if (lastSyncTimestamp == null) {
            return false;
        }
        return previousTimestamp == null || lastSyncTimestamp > previousTimestamp;
    }
}
