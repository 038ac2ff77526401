package com.koni.vitals.infrastructure.storage;

import com.koni.vitals.application.port.PartitionEncoder;
import com.koni.vitals.domain.exception.ColdStorageException;
import com.koni.vitals.domain.model.ArchivePartition;
import com.koni.vitals.domain.model.Sample;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Encodes archive partitions as Snappy-compressed Parquet files.
 */
@Slf4j
@Component
public class ParquetPartitionEncoder implements PartitionEncoder {
    
    public static final String EXTENSION = "parquet";
    public static final String CONTENT_TYPE = "application/vnd.apache.parquet";
    
    private final Configuration configuration = new Configuration(false);
    
    @Override
    public byte[] encode(ArchivePartition partition, List<Sample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot encode an empty partition: " + partition);
        }
        
        InMemoryOutputFile output = new InMemoryOutputFile();
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(output)
                .withSchema(SampleAvroSchema.SAMPLE_SCHEMA)
                .withConf(configuration)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (Sample sample : samples) {
                GenericRecord record = new GenericData.Record(SampleAvroSchema.SAMPLE_SCHEMA);
                record.put(SampleAvroSchema.TIMESTAMP, sample.getTimestamp());
                record.put(SampleAvroSchema.POINT_NAME, sample.getPointName());
                record.put(SampleAvroSchema.VALUE, sample.getValue());
                record.put(SampleAvroSchema.SITE_NAME, sample.getSite());
                writer.write(record);
            }
        } catch (IOException e) {
            throw new ColdStorageException("Failed to encode partition " + partition.objectKey(EXTENSION), e);
        }
        
        byte[] bytes = output.toByteArray();
        log.debug("Encoded partition key={}, rows={}, bytes={}",
                partition.objectKey(EXTENSION), samples.size(), bytes.length);
        return bytes;
    }
    
    @Override
    public String extension() {
        return EXTENSION;
    }
    
    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }
}
