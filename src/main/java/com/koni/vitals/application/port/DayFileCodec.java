package com.koni.vitals.application.port;

import com.koni.vitals.domain.model.Sample;

import java.util.List;

/**
 * Codec for the appendable per-site day files written by the backfill.
 */
public interface DayFileCodec {
    
    /**
     * Merges samples into an existing day file, keeping one sample per (point, timestamp)
     * in timestamp order. A later sample for the same key replaces the earlier one.
     *
     * @param existing the current file content, or null when the file does not exist yet
     * @param samples the samples to add
     * @return the new file content
     */
    byte[] merge(byte[] existing, List<Sample> samples);
    
    /**
     * Reads the samples of a day file. Lines carry no site, so the caller supplies it.
     */
    List<Sample> decode(String site, byte[] content);
    
    String extension();
    
    String contentType();
}
