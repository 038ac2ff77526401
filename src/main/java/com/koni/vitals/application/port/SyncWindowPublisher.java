package com.koni.vitals.application.port;

import com.koni.vitals.domain.event.SyncWindowRequested;

/**
 * Port for publishing sync window requests to the message queue.
 */
public interface SyncWindowPublisher {
    
    /**
     * @throws com.koni.vitals.domain.exception.QueueUnavailableException if the queue rejects the request
     */
    void publish(SyncWindowRequested request);
}
