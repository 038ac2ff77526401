package com.koni.vitals.infrastructure.web.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code PUT /api/v1/sites}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SiteListRequest {
    
    @NotNull(message = "sites is required")
    private List<String> sites;
}
