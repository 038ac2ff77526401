package com.koni.vitals.domain.model;

import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class TimeWindowTest {
    
    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");
    
    @Test
    void shouldCapAtTheEndAndKeepTheStart() {
        TimeWindow window = new TimeWindow(START, START.plus(Duration.ofHours(2)));
        
        TimeWindow capped = window.capTo(Duration.ofMinutes(30));
        
        assertThat(capped.getStart()).isEqualTo(START);
        assertThat(capped.getEnd()).isEqualTo(START.plus(Duration.ofMinutes(30)));
    }
    
    @Test
    void shouldNotCapShortWindow() {
        TimeWindow window = new TimeWindow(START, START.plus(Duration.ofMinutes(10)));
        
        assertThat(window.capTo(Duration.ofMinutes(30))).isSameAs(window);
    }
    
    @Test
    void shouldRejectInvertedWindow() {
        assertThatThrownBy(() -> new TimeWindow(START, START.minusSeconds(1)))
                .isInstanceOf(ValidationException.class);
    }
    
    @Test
    void shouldCoverWholeUtcDay() {
        TimeWindow day = TimeWindow.forDay(LocalDate.of(2025, 1, 1));
        
        assertThat(day.startIso()).isEqualTo("2025-01-01T00:00:00Z");
        assertThat(day.endIso()).isEqualTo("2025-01-01T23:59:59Z");
        assertThat(day.contains(START.toEpochMilli())).isTrue();
        assertThat(day.contains(START.plus(Duration.ofDays(1)).toEpochMilli())).isFalse();
    }
}
