package com.koni.vitals.application.port;

import com.koni.vitals.domain.model.StoredObject;

import java.util.Optional;

/**
 * Port for the cold object store.
 * All failures surface as {@link com.koni.vitals.domain.exception.ColdStorageException}.
 */
public interface ColdObjectStore {
    
    boolean exists(String key);
    
    /**
     * Reads object metadata; this is the verification read used before hot rows are deleted.
     */
    Optional<StoredObject> stat(String key);
    
    Optional<byte[]> get(String key);
    
    void put(String key, byte[] content, String contentType);
}
