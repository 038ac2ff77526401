package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.archive.ArchivalEngine;
import com.koni.vitals.domain.model.ArchiveRunStats;
import com.koni.vitals.tags.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@IntegrationTest
@WebMvcTest(ArchiveController.class)
@ActiveProfiles("test")
class ArchiveControllerTest {
    
    private static final Instant NOW = Instant.parse("2025-01-31T02:00:00Z");
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private ArchivalEngine archivalEngine;
    
    @Test
    void shouldAnswerNoContentBeforeFirstRun() throws Exception {
        when(archivalEngine.lastRun()).thenReturn(Optional.empty());
        
        mockMvc.perform(get("/api/v1/archive/status"))
                .andExpect(status().isNoContent());
    }
    
    @Test
    void shouldReturnLastRunStats() throws Exception {
        // Given
        ArchiveRunStats stats = new ArchiveRunStats("archive-20250131020000", NOW);
        stats.partitionArchived(1_440, 1_440);
        stats.finish(NOW.plusSeconds(4));
        when(archivalEngine.lastRun()).thenReturn(Optional.of(stats));
        
        // When / Then
        mockMvc.perform(get("/api/v1/archive/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("archive-20250131020000"))
                .andExpect(jsonPath("$.partitionsArchived").value(1))
                .andExpect(jsonPath("$.recordsDeleted").value(1_440))
                .andExpect(jsonPath("$.durationMillis").value(4_000));
    }
    
    @Test
    void shouldRunArchivalOnTrigger() throws Exception {
        when(archivalEngine.run()).thenReturn(new ArchiveRunStats("archive-1", NOW));
        
        mockMvc.perform(post("/api/v1/archive/trigger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("archive-1"));
    }
    
    @Test
    void shouldMapUnexpectedFailureToInternalError() throws Exception {
        when(archivalEngine.run()).thenThrow(new IllegalStateException("boom"));
        
        mockMvc.perform(post("/api/v1/archive/trigger"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }
}
