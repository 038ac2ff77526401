package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.service.SiteRegistry;
import com.koni.vitals.application.service.SyncWindowService;
import com.koni.vitals.application.sync.SiteStatus;
import com.koni.vitals.application.sync.SyncOrchestrator;
import com.koni.vitals.domain.event.SyncWindowRequested;
import com.koni.vitals.domain.exception.QueueUnavailableException;
import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.exception.UnknownSiteException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.model.Freshness;
import com.koni.vitals.domain.model.SiteSyncResult;
import com.koni.vitals.domain.model.SyncRunResult;
import com.koni.vitals.tags.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for SyncController and the error mapping of GlobalExceptionHandler.
 */
@IntegrationTest
@WebMvcTest(SyncController.class)
@ActiveProfiles("test")
class SyncControllerTest {
    
    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private SyncOrchestrator syncOrchestrator;
    
    @MockBean
    private SyncWindowService syncWindowService;
    
    @MockBean
    private SiteRegistry siteRegistry;
    
    private static SiteSyncResult failedSite(String site) {
        SiteSyncResult result = new SiteSyncResult(site);
        result.fail("upstream 502");
        return result;
    }
    
    @Test
    void shouldReportHealthWithEffectiveSettings() throws Exception {
        // Given
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("max_sites_per_run", 6);
        when(syncOrchestrator.name()).thenReturn("sync");
        when(syncOrchestrator.describe()).thenReturn(config);
        
        // When / Then
        mockMvc.perform(get("/api/v1/sync/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.worker").value("sync"))
                .andExpect(jsonPath("$.config.max_sites_per_run").value(6));
    }
    
    @Test
    void shouldReportNeverRunBeforeFirstRun() throws Exception {
        // Given
        when(syncOrchestrator.lastRun()).thenReturn(Optional.empty());
        when(syncOrchestrator.siteStatuses()).thenReturn(List.of(
                new SiteStatus("building-a", null, null, Freshness.UNKNOWN)));
        
        // When / Then
        mockMvc.perform(get("/api/v1/sync/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("never_run"))
                .andExpect(jsonPath("$.sites", hasSize(1)))
                .andExpect(jsonPath("$.sites[0].freshness").value("UNKNOWN"))
                .andExpect(jsonPath("$.errors", hasSize(0)));
    }
    
    @Test
    void shouldReportLastRunWithErrors() throws Exception {
        // Given
        SyncRunResult lastRun = new SyncRunResult("sync-20250115120000", NOW);
        lastRun.addSite(failedSite("building-b"));
        lastRun.addSite(failedSite("building-c"));
        lastRun.finish(NOW);
        when(syncOrchestrator.lastRun()).thenReturn(Optional.of(lastRun));
        when(syncOrchestrator.siteStatuses()).thenReturn(List.of());
        
        // When / Then
        mockMvc.perform(get("/api/v1/sync/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.lastRun.syncId").value("sync-20250115120000"))
                .andExpect(jsonPath("$.errors[0]").value("building-b: upstream 502"));
    }
    
    @Test
    void shouldAnswerSkippedTriggerWithOk() throws Exception {
        // Given
        when(syncOrchestrator.run()).thenReturn(SyncRunResult.lockHeld("sync-1", NOW));
        
        // When / Then
        mockMvc.perform(post("/api/v1/sync/trigger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("skipped"))
                .andExpect(jsonPath("$.lockAcquired").value(false));
    }
    
    @Test
    void shouldMapStateStoreOutageToServiceUnavailable() throws Exception {
        // Given
        when(syncOrchestrator.run()).thenThrow(new StateStoreUnavailableException("database down"));
        
        // When / Then
        mockMvc.perform(post("/api/v1/sync/trigger"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503))
                .andExpect(jsonPath("$.message").value("Service temporarily unavailable"));
    }
    
    @Test
    void shouldAcceptWindowRequest() throws Exception {
        // Given
        UUID requestId = UUID.randomUUID();
        when(syncWindowService.request(eq("building-a"), any(Instant.class), any(Instant.class), anyList()))
                .thenReturn(new SyncWindowRequested(requestId, "building-a",
                        Instant.parse("2025-01-31T10:00:00Z"), Instant.parse("2025-01-31T11:00:00Z"),
                        List.of("ahu1/sat"), NOW));
        String body = "{\"site\":\"building-a\",\"start\":\"2025-01-31T10:00:00Z\","
                + "\"end\":\"2025-01-31T11:00:00Z\",\"pointNames\":[\"ahu1/sat\"]}";
        
        // When / Then
        mockMvc.perform(post("/api/v1/sync/windows").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.requestId").value(requestId.toString()))
                .andExpect(jsonPath("$.site").value("building-a"));
    }
    
    @Test
    void shouldRejectWindowRequestWithoutSite() throws Exception {
        String body = "{\"start\":\"2025-01-31T10:00:00Z\",\"end\":\"2025-01-31T11:00:00Z\"}";
        
        mockMvc.perform(post("/api/v1/sync/windows").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value("site: site is required"));
        verify(syncWindowService, never()).request(any(), any(), any(), any());
    }
    
    @Test
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/sync/windows").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }
    
    @Test
    void shouldMapInvertedWindowToBadRequest() throws Exception {
        // Given
        when(syncWindowService.request(eq("building-a"), any(Instant.class), any(Instant.class), any()))
                .thenThrow(new ValidationException("window end must be after start"));
        String body = "{\"site\":\"building-a\",\"start\":\"2025-01-31T11:00:00Z\",\"end\":\"2025-01-31T10:00:00Z\"}";
        
        // When / Then
        mockMvc.perform(post("/api/v1/sync/windows").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("window end must be after start"));
    }
    
    @Test
    void shouldMapQueueOutageToServiceUnavailable() throws Exception {
        // Given
        when(syncWindowService.request(eq("building-a"), any(Instant.class), any(Instant.class), any()))
                .thenThrow(new QueueUnavailableException("broker unreachable"));
        String body = "{\"site\":\"building-a\",\"start\":\"2025-01-31T10:00:00Z\",\"end\":\"2025-01-31T11:00:00Z\"}";
        
        // When / Then
        mockMvc.perform(post("/api/v1/sync/windows").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isServiceUnavailable());
    }
    
    @Test
    void shouldResetKnownSite() throws Exception {
        mockMvc.perform(delete("/api/v1/sync/state/building-a"))
                .andExpect(status().isNoContent());
        
        verify(syncOrchestrator).resetSite("building-a");
    }
    
    @Test
    void shouldAnswerNotFoundForUnknownSite() throws Exception {
        // Given
        doThrow(new UnknownSiteException("Unknown site: building-z")).when(siteRegistry).requireKnown("building-z");
        
        // When / Then
        mockMvc.perform(delete("/api/v1/sync/state/building-z"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown site: building-z"));
        verify(syncOrchestrator, never()).resetSite(any());
    }
}
