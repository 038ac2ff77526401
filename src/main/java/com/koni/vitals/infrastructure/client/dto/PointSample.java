package com.koni.vitals.infrastructure.client.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.ToString;

/**
 * One raw sample as returned by the upstream API.
 * The value is kept as a JSON node because the API sends numbers, numeric strings, "NaN" and null.
 */
@Getter
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class PointSample {
    
    private final String name;
    private final JsonNode value;
    private final String time;
    
    @JsonCreator
    public PointSample(
            @JsonProperty("name") String name,
            @JsonProperty("value") JsonNode value,
            @JsonProperty("time") String time) {
        this.name = name;
        this.value = value;
        this.time = time;
    }
}
