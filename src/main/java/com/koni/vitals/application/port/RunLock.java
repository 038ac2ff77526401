package com.koni.vitals.application.port;

import java.time.Duration;
import java.util.Optional;

/**
 * Advisory, TTL-bounded lock used to avoid duplicate work between overlapping invocations.
 * It does not guarantee exclusivity: downstream writes are idempotent.
 */
public interface RunLock {
    
    /**
     * @return a lease token when no unexpired lock exists for the scope or the lock store is
     *         unreachable; empty when another holder's lock is still live
     */
    Optional<String> acquire(String scope, Duration ttl);
    
    /**
     * Deletes the lock only while it is still held under {@code leaseToken}. A lease that expired
     * and was taken over by another holder is left alone.
     */
    void release(String scope, String leaseToken);
}
