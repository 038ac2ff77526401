package com.koni.vitals.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/v1/backfill/trigger}.
 * {@code reset} discards the stored progress and starts the range over.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class BackfillTriggerRequest {
    
    @NotBlank(message = "site is required")
    private String site;
    
    private boolean reset;
}
