package com.koni.vitals.infrastructure.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.vitals.application.port.DayFileCodec;
import com.koni.vitals.domain.exception.ColdStorageException;
import com.koni.vitals.domain.model.Sample;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Day files as gzip-compressed newline-delimited JSON, one
 * {@code {"point_name", "timestamp", "value"}} object per line.
 */
@Component
@RequiredArgsConstructor
public class NdjsonGzipDayFileCodec implements DayFileCodec {
    
    public static final String EXTENSION = "ndjson.gz";
    public static final String CONTENT_TYPE = "application/x-ndjson";
    
    private static final Comparator<Line> LINE_ORDER =
            Comparator.comparingLong(Line::getTimestamp).thenComparing(Line::getPointName);
    
    private final ObjectMapper objectMapper;
    
    @Override
    public byte[] merge(byte[] existing, List<Sample> samples) {
        Map<String, Line> byIdentity = new LinkedHashMap<>();
        if (existing != null && existing.length > 0) {
            for (Line line : readLines(existing)) {
                byIdentity.put(line.identity(), line);
            }
        }
        for (Sample sample : samples) {
            Line line = new Line(sample.getPointName(), sample.getTimestamp(), sample.getValue());
            byIdentity.put(line.identity(), line);
        }
        
        List<Line> merged = new ArrayList<>(byIdentity.values());
        merged.sort(LINE_ORDER);
        return writeLines(merged);
    }
    
    @Override
    public List<Sample> decode(String site, byte[] content) {
        List<Sample> samples = new ArrayList<>();
        for (Line line : readLines(content)) {
            samples.add(new Sample(site, line.getPointName(), line.getTimestamp(), line.getValue()));
        }
        return samples;
    }
    
    @Override
    public String extension() {
        return EXTENSION;
    }
    
    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }
    
    private List<Line> readLines(byte[] content) {
        List<Line> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(new ByteArrayInputStream(content)), StandardCharsets.UTF_8))) {
            String json;
            while ((json = reader.readLine()) != null) {
                if (!json.isBlank()) {
                    lines.add(objectMapper.readValue(json, Line.class));
                }
            }
        } catch (IOException e) {
            throw new ColdStorageException("Failed to read day file", e);
        }
        return lines;
    }
    
    private byte[] writeLines(List<Line> lines) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(new GZIPOutputStream(bytes), StandardCharsets.UTF_8)) {
            for (Line line : lines) {
                writer.write(objectMapper.writeValueAsString(line));
                writer.write('\n');
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize day file line", e);
        } catch (IOException e) {
            throw new ColdStorageException("Failed to write day file", e);
        }
        return bytes.toByteArray();
    }
    
    @Getter
    static final class Line {
        
        @JsonProperty("point_name")
        private final String pointName;
        
        @JsonProperty("timestamp")
        private final long timestamp;
        
        @JsonProperty("value")
        private final double value;
        
        @JsonCreator
        Line(@JsonProperty("point_name") String pointName,
             @JsonProperty("timestamp") long timestamp,
             @JsonProperty("value") double value) {
            this.pointName = pointName;
            this.timestamp = timestamp;
            this.value = value;
        }
        
        String identity() {
            return pointName + ":" + timestamp;
        }
    }
}
