package com.koni.vitals.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * UTC clock that only moves when a test moves it.
 */
public class MutableClock extends Clock {
    
    private Instant now;
    
    public MutableClock(Instant now) {
        this.now = now;
    }
    
    public static MutableClock at(String isoInstant) {
        return new MutableClock(Instant.parse(isoInstant));
    }
    
    public void advance(Duration duration) {
        now = now.plus(duration);
    }
    
    public void set(Instant instant) {
        now = instant;
    }
    
    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }
    
    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
    
    @Override
    public Instant instant() {
        return now;
    }
}
