package com.koni.vitals.infrastructure.storage;

import com.koni.vitals.domain.exception.ColdStorageException;
import com.koni.vitals.domain.model.Sample;
import com.koni.vitals.support.TestProperties;
import com.koni.vitals.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for NdjsonGzipDayFileCodec.
 * Tests the line format and merge semantics of backfill day files.
 */
@UnitTest
class NdjsonGzipDayFileCodecTest {
    
    private final NdjsonGzipDayFileCodec codec = new NdjsonGzipDayFileCodec(TestProperties.objectMapper());
    
    private static Sample sample(String point, long timestamp, double value) {
        return new Sample("building-a", point, timestamp, value);
    }
    
    private static String gunzip(byte[] content) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(content))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
    
    @Test
    void shouldWriteOneJsonObjectPerLine() throws IOException {
        // When
        byte[] content = codec.merge(null, List.of(sample("ahu1/sat", 2000L, 21.5), sample("ahu1/rat", 1000L, 19.0)));
        
        // Then: lines sorted by timestamp
        assertThat(gunzip(content)).isEqualTo(
                "{\"point_name\":\"ahu1/rat\",\"timestamp\":1000,\"value\":19.0}\n"
                        + "{\"point_name\":\"ahu1/sat\",\"timestamp\":2000,\"value\":21.5}\n");
    }
    
    @Test
    void shouldMergeIntoExistingFileAndReplaceDuplicates() {
        // Given
        byte[] existing = codec.merge(null, List.of(sample("ahu1/sat", 1000L, 20.0), sample("ahu1/sat", 3000L, 22.0)));
        
        // When
        byte[] merged = codec.merge(existing, List.of(sample("ahu1/sat", 2000L, 21.0), sample("ahu1/sat", 3000L, 23.0)));
        
        // Then
        List<Sample> samples = codec.decode("building-a", merged);
        assertThat(samples).extracting(Sample::getTimestamp).containsExactly(1000L, 2000L, 3000L);
        assertThat(samples).extracting(Sample::getValue).containsExactly(20.0, 21.0, 23.0);
        assertThat(samples).extracting(Sample::getSite).containsOnly("building-a");
    }
    
    @Test
    void shouldTreatEmptyExistingContentAsNewFile() {
        byte[] merged = codec.merge(new byte[0], List.of(sample("ahu1/sat", 1000L, 20.0)));
        
        assertThat(codec.decode("building-a", merged)).hasSize(1);
    }
    
    @Test
    void shouldFailOnCorruptFile() {
        assertThatThrownBy(() -> codec.decode("building-a", "not gzip".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(ColdStorageException.class);
    }
}
