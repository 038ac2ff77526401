package com.koni.vitals.application.port;

import com.koni.vitals.domain.model.ArchivePartition;
import com.koni.vitals.domain.model.Sample;

import java.util.List;

/**
 * Encodes an archive partition into a compressed columnar object.
 */
public interface PartitionEncoder {
    
    byte[] encode(ArchivePartition partition, List<Sample> samples);
    
    String extension();
    
    String contentType();
}
