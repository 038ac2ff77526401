package com.koni.vitals.infrastructure.storage;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;

/**
 * Avro schema of the archived sample rows written to Parquet.
 */
public final class SampleAvroSchema {
    
    private SampleAvroSchema() {
    }
    
    public static final String TIMESTAMP = "timestamp";
    public static final String POINT_NAME = "point_name";
    public static final String VALUE = "value";
    public static final String SITE_NAME = "site_name";
    
    /** One row per sample: timestamp (timestamp-millis), point_name, value, site_name. */
    public static final Schema SAMPLE_SCHEMA;
    
    static {
        Schema timestampMillis = LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
        
        SAMPLE_SCHEMA = SchemaBuilder.record("ArchivedSample")
                .namespace("com.koni.vitals.archive")
                .fields()
                .name(TIMESTAMP).type(timestampMillis).noDefault()
                .requiredString(POINT_NAME)
                .requiredDouble(VALUE)
                .requiredString(SITE_NAME)
                .endRecord();
    }
}
