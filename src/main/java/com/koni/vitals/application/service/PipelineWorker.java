package com.koni.vitals.application.service;

import java.util.Map;

/**
 * A unit of scheduled pipeline work.
 *
 * Schedulers and HTTP triggers are thin adapters around {@link #run()}, so the same code path
 * runs whichever way an invocation starts.
 *
 * @param <R> the result of one invocation
 */
public interface PipelineWorker<R> {
    
    /**
     * Worker name used in logs and health responses.
     */
    String name();
    
    /**
     * Runs one invocation. All progress is checkpointed before returning.
     */
    R run();
    
    /**
     * Static configuration echoed by the worker's health endpoint.
     */
    Map<String, Object> describe();
}
