package com.koni.vitals.domain.model;

import java.time.LocalDate;

/**
 * Order in which a backfill walks its date range.
 */
public enum BackfillDirection {
    
    OLDEST_FIRST {
        @Override
        public LocalDate firstDay(LocalDate rangeStart, LocalDate rangeEnd) {
            return rangeStart;
        }
        
        @Override
        public LocalDate nextDay(LocalDate day) {
            return day.plusDays(1);
        }
    },
    
    NEWEST_FIRST {
        @Override
        public LocalDate firstDay(LocalDate rangeStart, LocalDate rangeEnd) {
            return rangeEnd;
        }
        
        @Override
        public LocalDate nextDay(LocalDate day) {
            return day.minusDays(1);
        }
    };
    
    public abstract LocalDate firstDay(LocalDate rangeStart, LocalDate rangeEnd);
    
    public abstract LocalDate nextDay(LocalDate day);
}
