package com.koni.vitals.application.service;

import com.koni.vitals.application.port.SyncWindowPublisher;
import com.koni.vitals.domain.event.SyncWindowRequested;
import com.koni.vitals.domain.exception.QueueUnavailableException;
import com.koni.vitals.domain.exception.UnknownSiteException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.support.MutableClock;
import com.koni.vitals.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@UnitTest
@ExtendWith(MockitoExtension.class)
class SyncWindowServiceTest {
    
    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");
    
    @Mock
    private SyncWindowPublisher publisher;
    
    @Mock
    private SiteRegistry siteRegistry;
    
    private SyncWindowService service;
    
    @BeforeEach
    void setUp() {
        service = new SyncWindowService(publisher, siteRegistry, new MutableClock(NOW));
    }
    
    @Test
    void shouldPublishValidRequest() {
        // When
        SyncWindowRequested request = service.request("building-a", NOW.minusSeconds(7200), NOW.minusSeconds(3600),
                List.of("ahu1/sat"));
        
        // Then
        ArgumentCaptor<SyncWindowRequested> captor = ArgumentCaptor.forClass(SyncWindowRequested.class);
        verify(publisher).publish(captor.capture());
        assertThat(captor.getValue()).isEqualTo(request);
        assertThat(request.getRequestId()).isNotNull();
        assertThat(request.getRequestedAt()).isEqualTo(NOW);
        assertThat(request.getPointNames()).containsExactly("ahu1/sat");
    }
    
    @Test
    void shouldRejectInvertedWindow() {
        assertThatThrownBy(() -> service.request("building-a", NOW, NOW.minusSeconds(60), null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(publisher);
    }
    
    @Test
    void shouldRejectWindowInTheFuture() {
        assertThatThrownBy(() -> service.request("building-a", NOW.plusSeconds(60), NOW.plusSeconds(120), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("future");
    }
    
    @Test
    void shouldRejectWindowLongerThanOneDay() {
        assertThatThrownBy(() -> service.request("building-a", NOW.minusSeconds(90_000), NOW, null))
                .isInstanceOf(ValidationException.class);
    }
    
    @Test
    void shouldRejectUnknownSite() {
        doThrow(new UnknownSiteException("Unknown site: campus-9")).when(siteRegistry).requireKnown("campus-9");
        
        assertThatThrownBy(() -> service.request("campus-9", NOW.minusSeconds(60), NOW, null))
                .isInstanceOf(UnknownSiteException.class);
        verifyNoInteractions(publisher);
    }
    
    @Test
    void shouldPropagateQueueOutage() {
        doThrow(new QueueUnavailableException("broker down")).when(publisher).publish(any());
        
        assertThatThrownBy(() -> service.request("building-a", NOW.minusSeconds(60), NOW, null))
                .isInstanceOf(QueueUnavailableException.class);
    }
}
