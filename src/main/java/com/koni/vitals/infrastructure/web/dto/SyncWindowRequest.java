package com.koni.vitals.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Body of {@code POST /api/v1/sync/windows}. An empty point list fetches every point.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SyncWindowRequest {
    
    @NotBlank(message = "site is required")
    private String site;
    
    @NotNull(message = "start is required")
    private Instant start;
    
    @NotNull(message = "end is required")
    private Instant end;
    
    private List<String> pointNames;
}
